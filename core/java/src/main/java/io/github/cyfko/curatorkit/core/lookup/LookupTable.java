package io.github.cyfko.curatorkit.core.lookup;

import io.github.cyfko.curatorkit.core.exception.LookupDefinitionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable map from normalized keys to curated values.
 *
 * <h2>Key degradation</h2>
 * <p>
 * A table declares its lookup columns; the first one is the primary column. A row is keyed by
 * the full tuple of its lookup values when all of them are non-empty, and by its primary value
 * alone otherwise. Rows with an empty primary value are skipped. Queries degrade the same way,
 * so a query carrying only the primary value finds the single-keyed entry and never a
 * tuple-keyed one.
 * </p>
 *
 * <pre>{@code
 * LookupTable<String> table = LookupTable.<String>builder("gene", List.of("Gene_lookup", "Variant_lookup"))
 *         .put(List.of("KRAS", "G12C"), "KRAS G12C")
 *         .put(List.of("KRAS", ""), "KRAS")
 *         .build();
 * table.find("kras", "g12c"); // Optional[KRAS G12C]
 * table.find("KRAS", null);   // Optional[KRAS]
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @param <V> the curated value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LookupTable<V> {

    private static final Logger log = Logger.getLogger(LookupTable.class.getName());

    private final String name;
    private final List<String> lookupColumns;
    private final Map<LookupKey, V> entries;

    private LookupTable(String name, List<String> lookupColumns, Map<LookupKey, V> entries) {
        this.name = name;
        this.lookupColumns = lookupColumns;
        this.entries = entries;
    }

    /**
     * @param name          table name used in log messages
     * @param lookupColumns the lookup columns, primary first
     * @param <V>           the curated value type
     * @return a new builder
     */
    public static <V> Builder<V> builder(String name, List<String> lookupColumns) {
        return new Builder<>(name, lookupColumns);
    }

    /**
     * Builds a table keyed on the {@code _lookup} columns of a resource, whose values are the rows.
     *
     * @param resource a curation resource
     * @return the table
     * @throws LookupDefinitionException if the resource has no lookup column
     */
    public static LookupTable<ResourceTable.Row> fromResource(ResourceTable resource) {
        return fromResource(resource, Function.identity());
    }

    /**
     * @param resource a curation resource
     * @param valueOf  builds the value of each row
     * @param <V>      the curated value type
     * @return the table
     * @throws LookupDefinitionException if the resource has no lookup column
     */
    public static <V> LookupTable<V> fromResource(ResourceTable resource, Function<ResourceTable.Row, V> valueOf) {
        List<String> columns = resource.lookupColumns();
        if (columns.isEmpty()) {
            throw new LookupDefinitionException(String.format(
                    "Resource '%s' has no '*%s' column; available: %s",
                    resource.name(), ResourceTable.LOOKUP_SUFFIX, resource.header()));
        }
        Builder<V> builder = builder(resource.name(), columns);
        for (ResourceTable.Row row : resource.rows()) {
            builder.put(row.values(columns), valueOf.apply(row));
        }
        return builder.build();
    }

    /**
     * Computes the key of a row or query.
     *
     * @param values lookup values, primary first; fewer values than the arity is allowed
     * @param arity  number of lookup columns of the table
     * @return the tuple key, the primary key, or {@code null} when the primary value is empty
     * @throws IllegalArgumentException if there are more values than lookup columns
     */
    public static LookupKey keyFor(List<?> values, int arity) {
        if (values.size() > arity) {
            throw new IllegalArgumentException(String.format(
                    "Got %d lookup value(s) for %d lookup column(s)", values.size(), arity));
        }
        if (values.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>(values.size());
        for (Object value : values) {
            parts.add(TextNormalizer.normalize(value));
        }
        if (parts.get(0).isEmpty()) {
            return null;
        }
        boolean complete = arity > 1 && parts.size() == arity && !parts.contains("");
        return complete ? new LookupKey(parts) : new LookupKey(List.of(parts.get(0)));
    }

    public String name() {
        return name;
    }

    public List<String> lookupColumns() {
        return lookupColumns;
    }

    public int arity() {
        return lookupColumns.size();
    }

    /**
     * @param values lookup values, primary first
     * @return the entry under the degraded key
     */
    public Optional<V> find(Object... values) {
        return find(Arrays.asList(values));
    }

    /**
     * @param values lookup values, primary first
     * @return the entry under the degraded key
     */
    public Optional<V> find(List<?> values) {
        LookupKey key = keyFor(values, arity());
        return key == null ? Optional.empty() : find(key);
    }

    /**
     * Exact lookup, without degradation.
     *
     * @param key the key
     * @return the entry
     */
    public Optional<V> find(LookupKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(LookupKey key) {
        return entries.containsKey(key);
    }

    /**
     * @return the keys, in insertion order
     */
    public Set<LookupKey> keys() {
        return entries.keySet();
    }

    public Map<LookupKey, V> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "LookupTable[name=" + name + ", columns=" + lookupColumns + ", size=" + entries.size() + "]";
    }

    /**
     * Builder for {@link LookupTable}. Duplicate keys keep the last value.
     *
     * @param <V> the curated value type
     */
    public static final class Builder<V> {

        private final String name;
        private final List<String> lookupColumns;
        private final Map<LookupKey, V> entries = new LinkedHashMap<>();
        private int skipped;

        private Builder(String name, List<String> lookupColumns) {
            Objects.requireNonNull(lookupColumns, "lookupColumns cannot be null");
            if (lookupColumns.isEmpty()) {
                throw new LookupDefinitionException(String.format("Lookup table '%s' needs at least one lookup column", name));
            }
            this.name = name == null ? "lookup" : name;
            this.lookupColumns = List.copyOf(lookupColumns);
        }

        /**
         * Adds a row.
         *
         * @param values the row's lookup values, one per lookup column
         * @param value  the curated value
         * @return this builder
         * @throws LookupDefinitionException if the number of values differs from the number of lookup columns
         */
        public Builder<V> put(List<?> values, V value) {
            if (values.size() != lookupColumns.size()) {
                throw new LookupDefinitionException(String.format(
                        "Lookup table '%s' expects %d lookup value(s) %s, got %d",
                        name, lookupColumns.size(), lookupColumns, values.size()));
            }
            LookupKey key = keyFor(values, lookupColumns.size());
            if (key == null) {
                skipped++;
                return this;
            }
            V previous = entries.put(key, value);
            if (previous != null && !previous.equals(value)) {
                log.warning(() -> String.format("Lookup table '%s': duplicate key %s, replacing %s with %s",
                        name, key, previous, value));
            }
            return this;
        }

        public LookupTable<V> build() {
            if (skipped > 0) {
                int count = skipped;
                log.fine(() -> String.format("Lookup table '%s': skipped %d row(s) with an empty primary value", name, count));
            }
            return new LookupTable<>(name, lookupColumns, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
