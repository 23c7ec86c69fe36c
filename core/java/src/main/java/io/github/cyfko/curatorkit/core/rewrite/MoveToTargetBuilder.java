package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.lookup.ResourceTable;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;

import java.util.Optional;

/**
 * Builds the leaf that replaces a moved leaf, from the row matched in the target resource.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TargetBuilders
 */
@FunctionalInterface
public interface MoveToTargetBuilder {

    /**
     * @param oldLeaf   the leaf being moved
     * @param targetRow the row of the target resource matching the leaf's primary key
     * @return the new leaf, or empty if the row does not hold what the target type needs
     */
    Optional<LeafCriterion> build(LeafCriterion oldLeaf, ResourceTable.Row targetRow);
}
