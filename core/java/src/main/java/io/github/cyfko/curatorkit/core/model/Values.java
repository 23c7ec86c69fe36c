package io.github.cyfko.curatorkit.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the value union carried by leaf fields.
 * <p>
 * A value is one of: {@code null}, {@link String}, {@link Long}, {@link Double},
 * {@link Boolean}, a {@link List} of values, or a nested {@link LeafCriterion}.
 * {@link Integer}, {@link Short}, {@link Byte} and {@link Float} are accepted on input
 * and widened to {@link Long} / {@link Double}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Values {

    private Values() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param value candidate value
     * @return true if the value (and, for lists, every element) belongs to the value union
     */
    public static boolean isValue(Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof LeafCriterion
                || isIntegral(value)
                || value instanceof Double
                || value instanceof Float) {
            return true;
        }
        if (value instanceof List<?>) {
            for (Object element : (List<?>) value) {
                if (!isValue(element)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Widens numeric types and copies lists into mutable {@link ArrayList}s.
     *
     * @param value a value accepted by {@link #isValue(Object)}
     * @return the canonical form of the value
     */
    public static Object normalize(Object value) {
        if (isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof List<?>) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(normalize(element));
            }
            return copy;
        }
        return value;
    }

    /**
     * Parses a bare number: first as a {@link Long}, then as a {@link Double}.
     *
     * @param token bare token text
     * @return the number, or {@code null} if the token is not numeric
     */
    public static Number parseNumber(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException ignored) {
            // not an integer, try a decimal below
        }
        try {
            double d = Double.parseDouble(token);
            if (Double.isNaN(d) || Double.isInfinite(d) || !looksNumeric(token)) {
                return null;
            }
            return d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Coerces a bareword the way both DSLs do: {@code true}, {@code false}, {@code null},
     * then integer, then decimal.
     *
     * @param token bare token text
     * @param fallback value returned when the token is none of the above
     * @return the coerced value, or {@code fallback}
     */
    public static Object coerceBareword(String token, Object fallback) {
        return switch (token) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            case "null" -> null;
            default -> {
                Number number = parseNumber(token);
                yield number != null ? number : fallback;
            }
        };
    }

    /**
     * @param fields leaf fields
     * @return an ordered copy sharing no mutable list or leaf with the original
     */
    public static Map<String, Object> deepCopyFields(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((k, v) -> copy.put(k, deepCopy(v)));
        return copy;
    }

    static Object deepCopy(Object value) {
        if (value instanceof LeafCriterion) {
            return ((LeafCriterion) value).deepCopy();
        }
        if (value instanceof List<?>) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        return value;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    // Double.parseDouble also accepts "Infinity", "NaN", "1f", "0x1p3"
    private static boolean looksNumeric(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (!(Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E')) {
                return false;
            }
        }
        return true;
    }
}
