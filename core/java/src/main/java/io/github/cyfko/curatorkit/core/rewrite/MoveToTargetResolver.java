package io.github.cyfko.curatorkit.core.rewrite;

import io.github.cyfko.curatorkit.core.lookup.ResourceTable;
import io.github.cyfko.curatorkit.core.lookup.TextNormalizer;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.ontology.OncoTree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves a Move-to target into the leaf replacing the moved one.
 *
 * <h2>Resolution</h2>
 * <ol>
 *   <li>The Move-to value names a registered resource, with or without a {@code .csv} suffix,
 *       case-insensitively.</li>
 *   <li>The first row whose first {@code _lookup} cell matches the moved leaf's primary key
 *       (normalized) is selected.</li>
 *   <li>The target builder is the first registered one whose marker occurs in the Move-to
 *       value, case-insensitively.</li>
 *   <li>The builder produces the new leaf.</li>
 * </ol>
 * <p>
 * A failure at any step resolves to nothing, and the caller removes the moved leaf.
 * </p>
 *
 * <pre>{@code
 * MoveToTargetResolver resolver = MoveToTargetResolver.builder()
 *         .resource(primaryTumorResource)
 *         .withDefaultTargets(tree)
 *         .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class MoveToTargetResolver {

    private static final Logger log = Logger.getLogger(MoveToTargetResolver.class.getName());

    private static final String CSV_SUFFIX = ".csv";

    private final Map<String, ResourceTable> resources;
    private final Map<String, MoveToTargetBuilder> targets;

    private MoveToTargetResolver(Map<String, ResourceTable> resources, Map<String, MoveToTargetBuilder> targets) {
        this.resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
        this.targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A resolver that knows no resource: every Move-to resolves to nothing.
     *
     * @return the resolver
     */
    public static MoveToTargetResolver none() {
        return builder().build();
    }

    /**
     * @param moveTo     the Move-to value of the matched lookup row
     * @param primaryKey the moved leaf's normalized primary key
     * @param oldLeaf    the moved leaf
     * @return the replacement leaf, or empty when the move cannot be completed
     */
    public Optional<LeafCriterion> resolve(String moveTo, String primaryKey, LeafCriterion oldLeaf) {
        if (TextNormalizer.isEffectivelyEmpty(moveTo) || TextNormalizer.isEffectivelyEmpty(primaryKey)) {
            return Optional.empty();
        }
        ResourceTable resource = resources.get(resourceKey(moveTo));
        if (resource == null) {
            log.fine(() -> String.format("Move-to '%s': no such resource", moveTo));
            return Optional.empty();
        }
        Optional<String> lookupColumn = resource.firstLookupColumn();
        if (lookupColumn.isEmpty()) {
            log.fine(() -> String.format("Move-to '%s': resource has no lookup column", moveTo));
            return Optional.empty();
        }
        Optional<ResourceTable.Row> row = resource.findFirst(lookupColumn.get(), primaryKey);
        if (row.isEmpty()) {
            log.fine(() -> String.format("Move-to '%s': no row for '%s'", moveTo, primaryKey));
            return Optional.empty();
        }
        MoveToTargetBuilder target = targetFor(moveTo);
        if (target == null) {
            log.fine(() -> String.format("Move-to '%s': no target builder matches", moveTo));
            return Optional.empty();
        }
        return target.build(oldLeaf, row.get());
    }

    public Map<String, ResourceTable> resources() {
        return resources;
    }

    private MoveToTargetBuilder targetFor(String moveTo) {
        String lower = moveTo.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, MoveToTargetBuilder> entry : targets.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    static String resourceKey(String name) {
        String key = name.strip().toLowerCase(Locale.ROOT);
        return key.endsWith(CSV_SUFFIX) ? key.substring(0, key.length() - CSV_SUFFIX.length()) : key;
    }

    /**
     * Builder for {@link MoveToTargetResolver}.
     */
    public static final class Builder {

        private final Map<String, ResourceTable> resources = new LinkedHashMap<>();
        private final Map<String, MoveToTargetBuilder> targets = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a resource under its own name.
         *
         * @param resource a Move-to target resource
         * @return this builder
         */
        public Builder resource(ResourceTable resource) {
            Objects.requireNonNull(resource, "resource cannot be null");
            resources.put(resourceKey(resource.name()), resource);
            return this;
        }

        /**
         * Registers a target builder, tried in registration order.
         *
         * @param marker  text that must occur in the Move-to value, case-insensitively
         * @param builder the builder
         * @return this builder
         */
        public Builder target(String marker, MoveToTargetBuilder builder) {
            if (marker == null || marker.isBlank()) {
                throw new IllegalArgumentException("Target marker is required");
            }
            targets.put(marker.strip().toLowerCase(Locale.ROOT), Objects.requireNonNull(builder, "builder cannot be null"));
            return this;
        }

        /**
         * Registers the primary tumour (both spellings) and molecular signature targets.
         *
         * @param tree the ontology used by the primary tumour target
         * @return this builder
         */
        public Builder withDefaultTargets(OncoTree tree) {
            MoveToTargetBuilder primaryTumor = TargetBuilders.primaryTumor(tree);
            return target("primarytumour", primaryTumor)
                    .target("primarytumor", primaryTumor)
                    .target("molecularsignature", TargetBuilders.molecularSignature());
        }

        public MoveToTargetResolver build() {
            return new MoveToTargetResolver(resources, targets);
        }
    }
}
