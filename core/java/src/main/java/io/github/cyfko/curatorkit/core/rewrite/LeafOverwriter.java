package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.lookup.LookupKey;
import io.github.cyfko.curatorkit.core.lookup.LookupTable;
import io.github.cyfko.curatorkit.core.lookup.ResourceTable;
import io.github.cyfko.curatorkit.core.model.Document;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.tree.NodeReplacer;
import io.github.cyfko.curatorkit.core.tree.NodeVisit;
import io.github.cyfko.curatorkit.core.tree.TreeWalker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Rewrites every leaf of one type through a lookup table.
 *
 * <h2>Per leaf</h2>
 * <ol>
 *   <li>The key is read from the configured fields and degraded like the table's keys.</li>
 *   <li>No key, or no entry under it: the leaf is removed.</li>
 *   <li>The entry has a Move-to target: the leaf is replaced by the leaf the
 *       {@link MoveToTargetResolver} builds, or removed if it builds none.</li>
 *   <li>Otherwise the {@link LeafRewrite} gives the new fields; no fields removes the leaf.</li>
 * </ol>
 * <p>
 * Removing a leaf from a required slot ({@code not} child, {@code if} condition or then-branch)
 * removes the enclosing node, see {@link NodeReplacer#remove(NodeVisit)}.
 * </p>
 *
 * <pre>{@code
 * LeafOverwriter<ResourceTable.Row> overwriter = LeafOverwriter.<ResourceTable.Row>builder()
 *         .targetType("GeneAlterationCriterion")
 *         .keyFields("gene", "alteration", "variant")
 *         .table(LookupTable.fromResource(geneResource))
 *         .moveTo(ResourceTable.Row::moveTo)
 *         .resolver(resolver)
 *         .rewrite(geneRewrite)
 *         .build();
 * OverwriteReport report = overwriter.overwrite(documents);
 * }</pre>
 *
 * @param <V> the lookup value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LeafOverwriter<V> {

    private static final Logger log = Logger.getLogger(LeafOverwriter.class.getName());

    private final String targetType;
    private final List<String> keyFields;
    private final LookupTable<V> table;
    private final Function<V, Optional<String>> moveTo;
    private final MoveToTargetResolver resolver;
    private final LeafRewrite<V> rewrite;

    private LeafOverwriter(Builder<V> builder) {
        this.targetType = builder.targetType;
        this.keyFields = List.copyOf(builder.keyFields);
        this.table = builder.table;
        this.moveTo = builder.moveTo;
        this.resolver = builder.resolver;
        this.rewrite = builder.rewrite;
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    /**
     * Overwriter for a curation resource: the table is keyed on the resource's lookup columns,
     * Move-to targets come from its Move-to column.
     *
     * @param targetType leaf type to rewrite
     * @param keyFields  leaf fields read in lookup column order
     * @param resource   the curation resource
     * @param resolver   Move-to resolver
     * @param rewrite    rewrite of the non-moved leaves
     * @return the overwriter
     */
    public static LeafOverwriter<ResourceTable.Row> forResource(String targetType, List<String> keyFields,
                                                                ResourceTable resource, MoveToTargetResolver resolver,
                                                                LeafRewrite<ResourceTable.Row> rewrite) {
        return LeafOverwriter.<ResourceTable.Row>builder()
                .targetType(targetType)
                .keyFields(keyFields)
                .table(LookupTable.fromResource(resource))
                .moveTo(ResourceTable.Row::moveTo)
                .resolver(resolver)
                .rewrite(rewrite)
                .build();
    }

    public String targetType() {
        return targetType;
    }

    /**
     * @param document the document to rewrite in place
     * @return the counts of this run
     */
    public OverwriteReport overwrite(Document document) {
        return overwrite(List.of(document));
    }

    /**
     * @param documents the documents to rewrite in place
     * @return the counts of this run
     */
    public OverwriteReport overwrite(Collection<Document> documents) {
        int[] counts = new int[4];
        TreeWalker.walkForRewrite(documents, visit -> {
            if (!visit.node().isLeaf() || !targetType.equals(visit.node().typeName())) {
                return;
            }
            counts[0]++;
            counts[apply(visit)]++;
        });
        OverwriteReport report = new OverwriteReport(counts[0], counts[1], counts[2], counts[3]);
        log.fine(() -> String.format("Overwrote '%s' leaves: %s", targetType, report));
        return report;
    }

    // index into the counts of overwrite(): 1 rewritten, 2 moved, 3 removed
    private int apply(NodeVisit visit) {
        LeafCriterion leaf = (LeafCriterion) visit.node();
        String documentId = visit.document().id();

        List<Object> values = new ArrayList<>(keyFields.size());
        for (String field : keyFields) {
            values.add(leaf.get(field));
        }
        LookupKey key = LookupTable.keyFor(values, table.arity());
        if (key == null) {
            log.fine(() -> String.format("Removing '%s' without lookup key in document '%s'", targetType, documentId));
            NodeReplacer.remove(visit);
            return 3;
        }
        Optional<V> entry = table.find(key);
        if (entry.isEmpty()) {
            log.fine(() -> String.format("Removing '%s' with unmapped key %s in document '%s'", targetType, key, documentId));
            NodeReplacer.remove(visit);
            return 3;
        }

        Optional<String> target = moveTo.apply(entry.get());
        if (target.isPresent()) {
            Optional<LeafCriterion> moved = resolver.resolve(target.get(), key.primary(), leaf);
            if (moved.isEmpty()) {
                log.fine(() -> String.format("Removing '%s' %s: Move-to '%s' unresolved in document '%s'",
                        targetType, key, target.get(), documentId));
                NodeReplacer.remove(visit);
                return 3;
            }
            NodeReplacer.moveTo(visit, moved.get().typeName(), moved.get().fields());
            return 2;
        }

        Map<String, Object> fields = rewrite.rewrite(leaf, entry.get());
        if (fields == null || fields.isEmpty()) {
            log.fine(() -> String.format("Removing '%s' %s: nothing curated in document '%s'", targetType, key, documentId));
            NodeReplacer.remove(visit);
            return 3;
        }
        leaf.fields().clear();
        fields.forEach(leaf::put);
        return 1;
    }

    /**
     * Builder for {@link LeafOverwriter}.
     *
     * @param <V> the lookup value type
     */
    public static final class Builder<V> {

        private String targetType;
        private List<String> keyFields = List.of();
        private LookupTable<V> table;
        private Function<V, Optional<String>> moveTo = entry -> Optional.empty();
        private MoveToTargetResolver resolver = MoveToTargetResolver.none();
        private LeafRewrite<V> rewrite;

        private Builder() {
        }

        public Builder<V> targetType(String targetType) {
            this.targetType = targetType;
            return this;
        }

        public Builder<V> keyFields(String... keyFields) {
            return keyFields(List.of(keyFields));
        }

        public Builder<V> keyFields(List<String> keyFields) {
            this.keyFields = Objects.requireNonNull(keyFields, "keyFields cannot be null");
            return this;
        }

        public Builder<V> table(LookupTable<V> table) {
            this.table = table;
            return this;
        }

        /**
         * @param moveTo extracts the Move-to target of an entry, if any
         * @return this builder
         */
        public Builder<V> moveTo(Function<V, Optional<String>> moveTo) {
            this.moveTo = Objects.requireNonNull(moveTo, "moveTo cannot be null");
            return this;
        }

        public Builder<V> resolver(MoveToTargetResolver resolver) {
            this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
            return this;
        }

        public Builder<V> rewrite(LeafRewrite<V> rewrite) {
            this.rewrite = rewrite;
            return this;
        }

        /**
         * @return the overwriter
         * @throws IllegalArgumentException if the type, table or rewrite is missing, or the key
         *                                  fields do not fit the table's lookup columns
         */
        public LeafOverwriter<V> build() {
            if (targetType == null || targetType.isBlank()) {
                throw new IllegalArgumentException("Target leaf type is required");
            }
            Objects.requireNonNull(table, "Lookup table is required");
            Objects.requireNonNull(rewrite, "Leaf rewrite is required");
            if (keyFields.isEmpty() || keyFields.size() > table.arity()) {
                throw new IllegalArgumentException(String.format(
                        "Expected 1 to %d key field(s) for lookup columns %s, got %s",
                        table.arity(), table.lookupColumns(), keyFields));
            }
            return new LeafOverwriter<>(this);
        }
    }
}
