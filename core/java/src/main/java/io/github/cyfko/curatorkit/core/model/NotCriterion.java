package io.github.cyfko.curatorkit.core.model;

import java.util.Objects;

/**
 * Negation of exactly one child; the child is never {@code null}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NotCriterion extends SingleChildCriterion {

    public NotCriterion(Criterion child) {
        super(child);
    }

    @Override
    public CriterionKind kind() {
        return CriterionKind.NOT;
    }

    @Override
    public String typeName() {
        return CriterionKind.NOT.keyword();
    }

    @Override
    public NotCriterion deepCopy() {
        return new NotCriterion(child().deepCopy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotCriterion)) return false;
        return child().equals(((NotCriterion) o).child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(CriterionKind.NOT, child());
    }
}
