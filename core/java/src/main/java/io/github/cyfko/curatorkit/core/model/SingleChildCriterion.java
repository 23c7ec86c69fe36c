package io.github.cyfko.curatorkit.core.model;

import java.util.Objects;

/**
 * Common base of {@link NotCriterion} and {@link TimingCriterion}: exactly one child, never
 * {@code null}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class SingleChildCriterion extends Criterion {

    private Criterion child;

    SingleChildCriterion(Criterion child) {
        this.child = requireChild(child);
    }

    public Criterion child() {
        return child;
    }

    public void setChild(Criterion child) {
        this.child = requireChild(child);
    }

    private Criterion requireChild(Criterion child) {
        return Objects.requireNonNull(child, () -> "'" + kind().keyword() + "' requires a child criterion");
    }
}
