package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.lookup.TextNormalizer;
import io.github.cyfko.curatorkit.core.ontology.OncoTree;
import io.github.cyfko.curatorkit.core.ontology.OncoTreeNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Turns a curated ontology cell such as {@code "Lung (LUNG) | Breast (BREAST)"} into the
 * {@value #TERM_FIELD} and {@value #LEVEL_FIELD} fields of a primary tumour leaf.
 * <p>
 * Every term must be known to the {@link OncoTree}; a single unknown term yields no fields,
 * which the overwrite engine turns into the removal of the leaf. With a canonical level,
 * every term is first lifted to its ancestor at that level, and duplicates collapse.
 * </p>
 *
 * <pre>{@code
 * OncoTreeLeveler leveler = new OncoTreeLeveler(tree);
 * leveler.levelFields("Lung Adenocarcinoma (LUAD)");
 * // Optional[{Oncotree_term=[Lung Adenocarcinoma (LUAD)], Oncotree_level=[3]}]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OncoTreeLeveler {

    private static final Logger log = Logger.getLogger(OncoTreeLeveler.class.getName());

    public static final String TERM_FIELD = "Oncotree_term";
    public static final String LEVEL_FIELD = "Oncotree_level";

    private final OncoTree tree;
    private final Integer canonicalLevel;

    /**
     * Leveler keeping every term at its own level.
     *
     * @param tree the ontology
     */
    public OncoTreeLeveler(OncoTree tree) {
        this(tree, null);
    }

    /**
     * @param tree           the ontology
     * @param canonicalLevel level every term is lifted to, or {@code null} to keep terms as curated
     */
    public OncoTreeLeveler(OncoTree tree, Integer canonicalLevel) {
        this.tree = Objects.requireNonNull(tree, "tree cannot be null");
        if (canonicalLevel != null && (canonicalLevel < 1 || canonicalLevel > OncoTree.MAX_LEVEL)) {
            throw new IllegalArgumentException(String.format(
                    "Canonical level must be between 1 and %d, got %d", OncoTree.MAX_LEVEL, canonicalLevel));
        }
        this.canonicalLevel = canonicalLevel;
    }

    /**
     * @param cell a curated cell, terms separated by {@code '|'}
     * @return the term and level fields, or empty if the cell is blank or a term cannot be placed
     */
    public Optional<Map<String, Object>> levelFields(Object cell) {
        List<String> terms = TextNormalizer.splitOrTerms(cell);
        if (terms.isEmpty()) {
            return Optional.empty();
        }
        if (canonicalLevel != null) {
            Optional<List<String>> lifted = liftAll(terms);
            if (lifted.isEmpty()) {
                return Optional.empty();
            }
            terms = lifted.get();
        }
        Optional<List<Integer>> levels = tree.levelsForTerms(terms);
        if (levels.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(TERM_FIELD, terms);
        fields.put(LEVEL_FIELD, levels.get());
        return Optional.of(fields);
    }

    /**
     * @param cellOf extracts the curated cell from a lookup entry
     * @param <V>    the lookup value type
     * @return a rewrite replacing the leaf's fields with {@link #levelFields(Object)}
     */
    public <V> LeafRewrite<V> asRewrite(Function<V, ?> cellOf) {
        return (leaf, entry) -> levelFields(cellOf.apply(entry)).orElse(null);
    }

    private Optional<List<String>> liftAll(List<String> terms) {
        List<String> lifted = new ArrayList<>(terms.size());
        for (String term : terms) {
            Optional<OncoTreeNode> ancestor = tree.find(term)
                    .flatMap(node -> tree.lift(node.code(), canonicalLevel));
            if (ancestor.isEmpty()) {
                log.fine(() -> String.format("Term '%s' has no ancestor at level %d", term, canonicalLevel));
                return Optional.empty();
            }
            if (!lifted.contains(ancestor.get().term())) {
                lifted.add(ancestor.get().term());
            }
        }
        return Optional.of(lifted);
    }
}
