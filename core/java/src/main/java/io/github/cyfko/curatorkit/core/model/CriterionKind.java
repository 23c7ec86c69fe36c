package io.github.cyfko.curatorkit.core.model;

/**
 * The six node variants of a criterion tree.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum CriterionKind {
    LEAF(null),
    AND("and"),
    OR("or"),
    NOT("not"),
    IF("if"),
    TIMING("timing");

    private final String keyword;

    CriterionKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return the Criterion-DSL keyword of a composite kind, {@code null} for {@link #LEAF}
     */
    public String keyword() {
        return keyword;
    }

    public boolean isComposite() {
        return this != LEAF;
    }
}
