package io.github.cyfko.curatorkit.core.lookup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Key of a {@link LookupTable}: a single normalized string or a tuple of them.
 * <p>
 * Parts are stored normalized (see {@link TextNormalizer#normalize(Object)}), so
 * {@code LookupKey.of("  KRAS ")} equals {@code LookupKey.of("kras")}.
 * </p>
 *
 * @param parts the normalized parts, at least one
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LookupKey(List<String> parts) {

    public LookupKey {
        Objects.requireNonNull(parts, "parts cannot be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("A lookup key needs at least one part");
        }
        List<String> normalized = new ArrayList<>(parts.size());
        for (String part : parts) {
            normalized.add(TextNormalizer.normalize(part));
        }
        parts = List.copyOf(normalized);
    }

    /**
     * @param values key parts, normalized on construction
     * @return the key
     */
    public static LookupKey of(Object... values) {
        List<String> parts = new ArrayList<>(values.length);
        for (Object value : values) {
            parts.add(TextNormalizer.normalize(value));
        }
        return new LookupKey(parts);
    }

    public boolean isTuple() {
        return parts.size() > 1;
    }

    /**
     * @return the first part, the value of the primary lookup column
     */
    public String primary() {
        return parts.get(0);
    }

    @Override
    public String toString() {
        return isTuple() ? "(" + String.join(", ", parts) + ")" : primary();
    }
}
