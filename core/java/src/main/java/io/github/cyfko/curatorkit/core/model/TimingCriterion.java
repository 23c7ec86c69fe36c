package io.github.cyfko.curatorkit.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Places one child criterion in time, e.g.
 * {@code timing(reference="last_dose", window_days=range(min_inclusive=28)){ priortherapy(...) }}.
 * <p>
 * The timing fields ({@code reference}, {@code window_days}, ...) are an ordered bag with the
 * same value rules as a {@link LeafCriterion}; the child sits in the single-child slot, like
 * the child of a {@code not}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TimingCriterion extends SingleChildCriterion {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public TimingCriterion(Criterion child) {
        this(Map.of(), child);
    }

    /**
     * @param fields timing fields, see {@link Values#isValue(Object)}
     * @param child  the timed criterion
     * @throws IllegalArgumentException if a field value is not supported
     */
    public TimingCriterion(Map<String, ?> fields, Criterion child) {
        super(child);
        Objects.requireNonNull(fields, "fields cannot be null");
        fields.forEach(this::put);
    }

    @Override
    public CriterionKind kind() {
        return CriterionKind.TIMING;
    }

    @Override
    public String typeName() {
        return CriterionKind.TIMING.keyword();
    }

    /**
     * @return the live, ordered timing fields
     */
    public Map<String, Object> fields() {
        return fields;
    }

    public Object get(String name) {
        return fields.get(name);
    }

    public TimingCriterion put(String name, Object value) {
        Objects.requireNonNull(name, "field name cannot be null");
        if (!Values.isValue(value)) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported value type %s for field '%s' of 'timing'", value.getClass().getName(), name));
        }
        fields.put(name, Values.normalize(value));
        return this;
    }

    @Override
    public TimingCriterion deepCopy() {
        return new TimingCriterion(Values.deepCopyFields(fields), child().deepCopy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimingCriterion)) return false;
        TimingCriterion other = (TimingCriterion) o;
        return fields.equals(other.fields) && child().equals(other.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(CriterionKind.TIMING, fields, child());
    }
}
