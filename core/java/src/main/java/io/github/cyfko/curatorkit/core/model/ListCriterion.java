package io.github.cyfko.curatorkit.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Common base of {@link AndCriterion} and {@link OrCriterion}: an ordered, possibly empty
 * list of children.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class ListCriterion extends Criterion {

    private final List<Criterion> children;

    ListCriterion(Collection<? extends Criterion> children) {
        Objects.requireNonNull(children, "children cannot be null");
        this.children = new ArrayList<>(children.size());
        for (Criterion child : children) {
            this.children.add(Objects.requireNonNull(child, "child criterion cannot be null"));
        }
    }

    /**
     * @return the live, mutable list of children
     */
    public List<Criterion> children() {
        return children;
    }

    List<Criterion> copyChildren() {
        List<Criterion> copy = new ArrayList<>(children.size());
        for (Criterion child : children) {
            copy.add(child.deepCopy());
        }
        return copy;
    }

    @Override
    public String typeName() {
        return kind().keyword();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return children.equals(((ListCriterion) o).children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), children);
    }
}
