package io.github.cyfko.curatorkit.core.model;

import java.util.Objects;

/**
 * Conditional criterion: {@code if{condition} then{then} else{else}}.
 * <p>
 * The condition and the then-branch are required; the else-branch is optional.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class IfCriterion extends Criterion {

    private Criterion condition;
    private Criterion thenBranch;
    private Criterion elseBranch;

    public IfCriterion(Criterion condition, Criterion thenBranch) {
        this(condition, thenBranch, null);
    }

    public IfCriterion(Criterion condition, Criterion thenBranch, Criterion elseBranch) {
        this.condition = Objects.requireNonNull(condition, "'if' requires a condition");
        this.thenBranch = Objects.requireNonNull(thenBranch, "'if' requires a then-branch");
        this.elseBranch = elseBranch;
    }

    @Override
    public CriterionKind kind() {
        return CriterionKind.IF;
    }

    @Override
    public String typeName() {
        return CriterionKind.IF.keyword();
    }

    public Criterion condition() {
        return condition;
    }

    public Criterion thenBranch() {
        return thenBranch;
    }

    /**
     * @return the else-branch, or {@code null} when absent
     */
    public Criterion elseBranch() {
        return elseBranch;
    }

    public void setCondition(Criterion condition) {
        this.condition = Objects.requireNonNull(condition, "'if' requires a condition");
    }

    public void setThenBranch(Criterion thenBranch) {
        this.thenBranch = Objects.requireNonNull(thenBranch, "'if' requires a then-branch");
    }

    public void setElseBranch(Criterion elseBranch) {
        this.elseBranch = elseBranch;
    }

    @Override
    public IfCriterion deepCopy() {
        return new IfCriterion(condition.deepCopy(), thenBranch.deepCopy(),
                elseBranch == null ? null : elseBranch.deepCopy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IfCriterion)) return false;
        IfCriterion other = (IfCriterion) o;
        return condition.equals(other.condition)
                && thenBranch.equals(other.thenBranch)
                && Objects.equals(elseBranch, other.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CriterionKind.IF, condition, thenBranch, elseBranch);
    }
}
