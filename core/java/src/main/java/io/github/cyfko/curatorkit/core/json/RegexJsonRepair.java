package io.github.cyfko.curatorkit.core.json;

import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;
import io.github.cyfko.curatorkit.core.parsing.ArithmeticEvaluator;

import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual repair of common language-model JSON mistakes, applied before a strict parse.
 * <p>
 * The repairs, in order:
 * </p>
 * <ol>
 *   <li>Keep only the content of the first markdown code fence, if any.</li>
 *   <li>Strip {@code //} and {@code /* *}{@code /} comments. A {@code //} right after a number or a
 *       closing parenthesis is floor division and stays.</li>
 *   <li>{@code { "X" }} becomes {@code "X"}.</li>
 *   <li>{@code "a": "B": [..]} and {@code "a": "B": "C"} become {@code "a": { "B": .. }}.</li>
 *   <li>Unquoted arithmetic such as {@code 5+5} is replaced by its value.</li>
 *   <li>Python literals {@code True}, {@code False}, {@code None} become JSON literals.</li>
 *   <li>Trailing commas before {@code '}'} or {@code ']'} are dropped.</li>
 *   <li>Bare object keys are quoted.</li>
 * </ol>
 * <p>
 * Steps 2 and 5 to 8 never touch the content of quoted strings. The result is not guaranteed
 * to be valid JSON; the caller parses it strictly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RegexJsonRepair {

    private static final Logger log = Logger.getLogger(RegexJsonRepair.class.getName());

    private static final Pattern CODE_FENCE = Pattern.compile("```[A-Za-z]*[ \\t]*\\R?(.*?)```", Pattern.DOTALL);
    private static final Pattern LONE_KEY = Pattern.compile("\\{\\s*(\"\\w+\")\\s*}");
    private static final Pattern KEY_CHAIN_LIST = Pattern.compile("(\"\\w+\")\\s*:\\s*(\"\\w+\")\\s*:\\s*(\\[[^\\]]*])");
    private static final Pattern KEY_CHAIN_STRING = Pattern.compile("(\"\\w+\")\\s*:\\s*(\"\\w+\")\\s*:\\s*(\"\\w+\")");
    private static final Pattern MATH_VALUE = Pattern.compile("([:\\[,]\\s*)([\\d.\\s+\\-*/()%]+\\d)(\\s*)(?=[,\\]}])");
    private static final Pattern PYTHON_LITERAL = Pattern.compile("\\b(True|False|None)\\b");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");
    private static final Pattern BARE_KEY = Pattern.compile("([{,]\\s*)([A-Za-z_][A-Za-z0-9_]*)(\\s*:)");

    private RegexJsonRepair() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param text JSON-shaped text
     * @return the repaired text
     */
    public static String repair(String text) {
        String repaired = extractCodeFence(text);
        repaired = stripComments(repaired);
        repaired = LONE_KEY.matcher(repaired).replaceAll("$1");
        repaired = KEY_CHAIN_LIST.matcher(repaired).replaceAll("$1: { $2: $3 }");
        repaired = KEY_CHAIN_STRING.matcher(repaired).replaceAll("$1: { $2: $3 }");
        repaired = outsideStrings(repaired, RegexJsonRepair::evaluateMath);
        repaired = outsideStrings(repaired, s -> PYTHON_LITERAL.matcher(s).replaceAll(m -> switch (m.group(1)) {
            case "True" -> "true";
            case "False" -> "false";
            default -> "null";
        }));
        repaired = outsideStrings(repaired, s -> TRAILING_COMMA.matcher(s).replaceAll("$1"));
        repaired = outsideStrings(repaired, s -> BARE_KEY.matcher(s).replaceAll("$1\"$2\"$3"));

        if (log.isLoggable(Level.FINE) && !repaired.equals(text)) {
            String result = repaired;
            log.fine(() -> String.format("Repaired JSON text (%d -> %d characters): %s", text.length(), result.length(), result));
        }
        return repaired;
    }

    static String extractCodeFence(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        return matcher.find() ? matcher.group(1) : text;
    }

    static String stripComments(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inString = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inString) {
                sb.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    sb.append(text.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    inString = false;
                }
                i++;
            } else if (c == '"') {
                inString = true;
                sb.append(c);
                i++;
            } else if (text.startsWith("//", i) && !followsOperand(sb)) {
                int end = text.indexOf('\n', i);
                i = end < 0 ? text.length() : end;
            } else if (text.startsWith("/*", i)) {
                int end = text.indexOf("*/", i + 2);
                i = end < 0 ? text.length() : end + 2;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    // "20 // 2" is floor division, not a comment
    private static boolean followsOperand(CharSequence sb) {
        for (int j = sb.length() - 1; j >= 0; j--) {
            char c = sb.charAt(j);
            if (!Character.isWhitespace(c)) {
                return Character.isDigit(c) || c == ')';
            }
        }
        return false;
    }

    /**
     * Applies a rewrite to every stretch of text that is not inside a double-quoted string.
     */
    static String outsideStrings(String text, UnaryOperator<String> rewrite) {
        StringBuilder sb = new StringBuilder(text.length());
        int segmentStart = 0;
        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) != '"') {
                i++;
                continue;
            }
            sb.append(rewrite.apply(text.substring(segmentStart, i)));
            int end = i + 1;
            while (end < text.length() && text.charAt(end) != '"') {
                end += text.charAt(end) == '\\' ? 2 : 1;
            }
            end = Math.min(end + 1, text.length());
            sb.append(text, i, end);
            segmentStart = end;
            i = end;
        }
        sb.append(rewrite.apply(text.substring(segmentStart)));
        return sb.toString();
    }

    private static String evaluateMath(String segment) {
        Matcher matcher = MATH_VALUE.matcher(segment);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String expression = matcher.group(2);
            String replacement = matcher.group();
            try {
                Number value = ArithmeticEvaluator.evaluate(expression.strip());
                replacement = matcher.group(1) + value + matcher.group(3);
            } catch (DSLSyntaxException e) {
                log.fine(() -> String.format("Left '%s' unevaluated: %s", expression.strip(), e.getMessage()));
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
