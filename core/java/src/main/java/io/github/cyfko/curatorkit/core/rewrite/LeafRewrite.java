package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.model.LeafCriterion;

import java.util.Map;

/**
 * Computes the new fields of a leaf from the lookup entry it matched.
 *
 * @param <V> the lookup value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface LeafRewrite<V> {

    /**
     * @param leaf  the matched leaf, not modified by this call
     * @param entry the lookup entry found for the leaf
     * @return the new fields replacing all current ones; {@code null} or empty removes the leaf
     */
    Map<String, Object> rewrite(LeafCriterion leaf, V entry);
}
