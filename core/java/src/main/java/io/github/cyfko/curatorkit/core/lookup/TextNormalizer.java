package io.github.cyfko.curatorkit.core.lookup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Normalisation of the cells and field values compared by lookup tables and the ontology.
 * <p>
 * {@link #normalize(Object)} trims, repairs mojibake and lower-cases. The tokens
 * {@code ""}, {@code "na"}, {@code "n/a"} and {@code "unknown"}, {@code null} and
 * {@code NaN} all normalise to the empty string.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TextNormalizer {

    private static final Set<String> EMPTY_TOKENS = Set.of("", "na", "n/a", "unknown");

    // UTF-8 text decoded as Windows-1252 / Mac Roman, back to the intended character
    private static final Map<String, String> MOJIBAKE = new LinkedHashMap<>();

    static {
        MOJIBAKE.put("\u201a\u00e2\u2022", "\u2265");
        MOJIBAKE.put("\u00e2\u2030\u00a5", "\u2265");
        MOJIBAKE.put("\u00e2\u2030\u00a4", "\u2264");
        MOJIBAKE.put("\u00e2\u20ac\u00a2", "\u2022");
        MOJIBAKE.put("\u00e2\u2014", "\u2022");
        MOJIBAKE.put("\u00e2\u20ac\u201c", "-");
        MOJIBAKE.put("\u00e2\u20ac\u201d", "-");
        MOJIBAKE.put("\u00e2\u20ac\u02dc", "'");
        MOJIBAKE.put("\u00e2\u20ac\u2122", "'");
        MOJIBAKE.put("\u00e2\u20ac\u0153", "\"");
        MOJIBAKE.put("\u00e2\u20ac\ufffd", "\"");
        MOJIBAKE.put("\u00c3\u2014", "\u00d7");
        MOJIBAKE.put("\u00c3\u00b7", "\u00f7");
        MOJIBAKE.put("\u00c2\u00b1", "\u00b1");
        MOJIBAKE.put("\u00c2\u00b0", "\u00b0");
        MOJIBAKE.put("\u00c2 ", " ");
    }

    private TextNormalizer() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param value a cell or field value of any type
     * @return the trimmed, repaired, lower-cased text; empty for empty tokens
     */
    public static String normalize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double && ((Double) value).isNaN()) {
            return "";
        }
        if (value instanceof Float && ((Float) value).isNaN()) {
            return "";
        }
        String normalized = fixMojibake(String.valueOf(value)).strip().toLowerCase(Locale.ROOT);
        return EMPTY_TOKENS.contains(normalized) ? "" : normalized;
    }

    public static boolean isEffectivelyEmpty(Object value) {
        return normalize(value).isEmpty();
    }

    /**
     * @param value text possibly containing mojibake
     * @return the text with every known sequence replaced
     */
    public static String fixMojibake(String value) {
        if (value == null) {
            return null;
        }
        String result = value;
        for (Map.Entry<String, String> entry : MOJIBAKE.entrySet()) {
            if (result.contains(entry.getKey())) {
                result = result.replace(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Splits a curated cell into alternatives on {@code '|'}. Commas are literal.
     *
     * @param value a curated cell such as {@code "Lung (LUNG) | Breast (BREAST)"}
     * @return the trimmed, non-empty terms; empty for an empty cell
     */
    public static List<String> splitOrTerms(Object value) {
        if (isEffectivelyEmpty(value)) {
            return Collections.emptyList();
        }
        return split(fixMojibake(String.valueOf(value)).strip());
    }

    /**
     * Same as {@link #splitOrTerms(Object)}, after removing parentheses wrapping the whole cell.
     *
     * @param value a curated cell such as {@code "(KRAS | NRAS)"}
     * @return the terms
     */
    public static List<String> splitOrTermsStrippingParens(Object value) {
        if (isEffectivelyEmpty(value)) {
            return Collections.emptyList();
        }
        return split(stripOuterParens(fixMojibake(String.valueOf(value))));
    }

    /**
     * Removes balanced parentheses wrapping the whole text, repeatedly:
     * {@code "((a | b))"} gives {@code "a | b"}; {@code "(a) | (b)"} is kept as is.
     *
     * @param value the text
     * @return the unwrapped, trimmed text
     */
    public static String stripOuterParens(String value) {
        String text = value.strip();
        while (text.length() >= 2 && text.charAt(0) == '(' && text.charAt(text.length() - 1) == ')'
                && closingParenOf(text) == text.length() - 1) {
            text = text.substring(1, text.length() - 1).strip();
        }
        return text;
    }

    // index of the parenthesis closing the one at index 0, or -1
    private static int closingParenOf(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static List<String> split(String text) {
        List<String> terms = new ArrayList<>();
        for (String part : text.split("\\|")) {
            String term = part.strip();
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }
}
