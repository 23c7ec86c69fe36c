package io.github.cyfko.curatorkit.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A leaf criterion: a type name and an ordered bag of fields.
 * <p>
 * One generic class represents every leaf type, so new or unknown types need no code.
 * Field values are restricted to the types accepted by {@link Values#isValue(Object)}.
 * </p>
 *
 * <pre>{@code
 * LeafCriterion leaf = new LeafCriterion("age", Map.of("min", 18L));
 * leaf.put("max", 75L);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LeafCriterion extends Criterion {

    private final String typeName;
    private final Map<String, Object> fields;

    /**
     * Creates a leaf without fields.
     *
     * @param typeName the leaf type, never blank
     */
    public LeafCriterion(String typeName) {
        this(typeName, Map.of());
    }

    /**
     * Creates a leaf with a copy of the given fields, in the map's iteration order.
     *
     * @param typeName the leaf type, never blank
     * @param fields   field values, see {@link Values#isValue(Object)}
     * @throws IllegalArgumentException if the type name is blank or a value is not supported
     */
    public LeafCriterion(String typeName, Map<String, ?> fields) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Leaf type name is required");
        }
        Objects.requireNonNull(fields, "fields cannot be null");
        this.typeName = typeName;
        this.fields = new LinkedHashMap<>();
        fields.forEach(this::put);
    }

    @Override
    public CriterionKind kind() {
        return CriterionKind.LEAF;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    /**
     * @return the live, ordered field map of this leaf
     */
    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * @param name field name
     * @return the field value, or {@code null} if absent
     */
    public Object get(String name) {
        return fields.get(name);
    }

    /**
     * Sets a field, keeping its position if it already exists.
     *
     * @param name  field name
     * @param value field value, see {@link Values#isValue(Object)}
     * @return this leaf
     */
    public LeafCriterion put(String name, Object value) {
        Objects.requireNonNull(name, "field name cannot be null");
        if (!Values.isValue(value)) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported value type %s for field '%s' of '%s'",
                    value.getClass().getName(), name, typeName));
        }
        fields.put(name, Values.normalize(value));
        return this;
    }

    @Override
    public LeafCriterion deepCopy() {
        return new LeafCriterion(typeName, Values.deepCopyFields(fields));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LeafCriterion)) return false;
        LeafCriterion other = (LeafCriterion) o;
        return typeName.equals(other.typeName) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeName, fields);
    }
}
