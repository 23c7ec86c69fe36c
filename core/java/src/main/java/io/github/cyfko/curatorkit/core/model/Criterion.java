package io.github.cyfko.curatorkit.core.model;

import io.github.cyfko.curatorkit.core.format.CriterionFormatter;

/**
 * A node of a criterion tree.
 * <p>
 * Exactly six concrete variants exist, identified by {@link #kind()}:
 * </p>
 * <ul>
 *   <li>{@link LeafCriterion} - a typed bag of fields, e.g. {@code histology(histology_type="sarcomatoid")}</li>
 *   <li>{@link AndCriterion} / {@link OrCriterion} - an ordered list of children (possibly empty)</li>
 *   <li>{@link NotCriterion} - exactly one child</li>
 *   <li>{@link IfCriterion} - a condition, a then-branch and an optional else-branch</li>
 *   <li>{@link TimingCriterion} - timing fields around exactly one child</li>
 * </ul>
 *
 * <p>
 * Nodes are mutable: pruning and move-to rewrite trees in place. Equality is structural so
 * that two parses of the same text compare equal, but every rewrite locates a node by
 * identity because sibling leaves may be field-for-field identical.
 * </p>
 *
 * <p>Trees are not thread-safe; each parsed document owns its own tree.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class Criterion {

    Criterion() {
    }

    /**
     * @return the variant of this node
     */
    public abstract CriterionKind kind();

    /**
     * Returns the name used to match this node against a set of target types.
     * <p>
     * Leaves return their own type name; composites return their keyword
     * ({@code "and"}, {@code "or"}, {@code "not"}, {@code "if"}).
     * </p>
     *
     * @return the type name of this node
     */
    public abstract String typeName();

    /**
     * @return a structurally equal tree sharing no node with this one
     */
    public abstract Criterion deepCopy();

    public boolean isLeaf() {
        return kind() == CriterionKind.LEAF;
    }

    @Override
    public String toString() {
        return CriterionFormatter.formatCompact(this);
    }
}
