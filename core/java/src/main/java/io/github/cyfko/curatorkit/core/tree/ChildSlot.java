package io.github.cyfko.curatorkit.core.tree;

/**
 * The places a child can occupy in its parent, in the order children are visited.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ChildSlot {
    /** An element of the list of an {@code and} or {@code or} node. */
    CRITERIA,
    /** The single child of a {@code not} or {@code timing} node. */
    CRITERION,
    /** The condition of an {@code if} node. */
    CONDITION,
    /** The then-branch of an {@code if} node. */
    THEN,
    /** The optional else-branch of an {@code if} node. */
    ELSE;

    /**
     * @return true if the parent cannot exist without a child in this slot
     */
    public boolean isRequired() {
        return this == CRITERION || this == CONDITION || this == THEN;
    }
}
