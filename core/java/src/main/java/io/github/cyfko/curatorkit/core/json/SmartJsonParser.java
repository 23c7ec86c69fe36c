package io.github.cyfko.curatorkit.core.json;

import io.github.cyfko.curatorkit.core.config.ParserPolicy;
import io.github.cyfko.curatorkit.core.config.PatternConfig;
import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;
import io.github.cyfko.curatorkit.core.model.Values;
import io.github.cyfko.curatorkit.core.parsing.ArithmeticEvaluator;
import io.github.cyfko.curatorkit.core.parsing.Scanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Parser for JSON-shaped text produced by a language model.
 * <p>
 * Well-formed JSON parses to the same values a strict parser produces: {@link LinkedHashMap},
 * {@link ArrayList}, {@link String}, {@link Long}, {@link Double}, {@link Boolean} and
 * {@code null}. On top of that, the following malformations are repaired:
 * </p>
 * <ol>
 *   <li><strong>Lone key</strong>: {@code { "X" }} becomes the string {@code "X"}.</li>
 *   <li><strong>Collapsed key chain</strong>: {@code "k1": "k2": v} becomes
 *       {@code "k1": {"k2": v}}, repeatedly for longer chains.</li>
 *   <li><strong>Arithmetic literal</strong>: an unquoted {@code 5+5} becomes {@code 10}.
 *       Quoted strings are never evaluated.</li>
 *   <li><strong>Missing closing brace</strong>: a sibling object ({@code ,{}) or the end of the
 *       enclosing array ({@code ]}) met before {@code '}'} closes the object implicitly.</li>
 * </ol>
 * <p>
 * Each repair is logged at WARNING and recorded in {@link #warnings()}. Anything else that is
 * not JSON raises a {@link DSLSyntaxException}.
 * </p>
 *
 * <p>An instance is single-use: create one per text.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SmartJsonParser {

    private static final Logger log = Logger.getLogger(SmartJsonParser.class.getName());

    private final Scanner scanner;
    private final List<String> warnings = new ArrayList<>();

    public SmartJsonParser(String text) {
        this(text, ParserPolicy.defaults());
    }

    public SmartJsonParser(String text, ParserPolicy policy) {
        this.scanner = new Scanner(text, policy);
    }

    /**
     * Convenience method parsing a text with the default policy.
     *
     * @param text JSON-shaped text
     * @return the parsed value
     * @throws DSLSyntaxException if the text cannot be repaired
     */
    public static Object parseText(String text) {
        return new SmartJsonParser(text).parse();
    }

    /**
     * Parses the whole text as one value.
     *
     * @return the parsed value
     * @throws DSLSyntaxException if the text cannot be repaired or has trailing content
     */
    public Object parse() {
        scanner.consumeWhitespace();
        if (scanner.isEof()) {
            throw scanner.fail("Expected a JSON value, got end of input");
        }
        Object value = value();
        scanner.consumeWhitespace();
        if (!scanner.isEof()) {
            throw scanner.fail("Unexpected trailing input " + scanner.describeCurrent() + " after JSON value");
        }
        return value;
    }

    /**
     * @return the repairs applied so far, in order
     */
    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    private Object value() {
        scanner.consumeWhitespace();
        char c = scanner.peek();
        if (c == '"') {
            return scanner.consumeQuotedString('"');
        }
        if (c == '[') {
            List<Object> items = new ArrayList<>();
            scanner.consumeDelimited('[', ']', () -> items.add(value()), null);
            return items;
        }
        if (c == '{') {
            return object();
        }
        return bareValue();
    }

    private Object object() {
        int start = scanner.position();
        Map<String, Object> object = new LinkedHashMap<>();
        List<String> loneKeys = new ArrayList<>();

        boolean closed = scanner.consumeDelimited('{', '}', () -> {
            int keyStart = scanner.position();
            String key = scanner.consumeQuotedString('"');
            scanner.consumeWhitespace();
            if (scanner.peek() == ':') {
                scanner.consume();
                object.put(key, chainedValue());
            } else if (loneKeys.isEmpty()) {
                loneKeys.add(key);
            } else {
                throw scanner.failAt(String.format("Expected ':' after key \"%s\", got %s", key, scanner.describeCurrent()), keyStart);
            }
        }, PatternConfig.JSON_MISSING_BRACE_LOOKAHEAD);

        if (!closed) {
            recordWarning(String.format("Missing '}' for the object opened at offset %d, closed before %s",
                    start, scanner.describeCurrent()));
        }
        if (!loneKeys.isEmpty()) {
            // a lone key beside pairs is refused rather than returned in place of the object,
            // which would silently drop the pairs (see "Lone keys" in DESIGN.md)
            if (!object.isEmpty()) {
                throw scanner.failAt(String.format("Object at offset %d mixes the lone key \"%s\" with key-value pairs",
                        start, loneKeys.get(0)), start);
            }
            recordWarning(String.format("Lone key \"%s\" at offset %d read as a string", loneKeys.get(0), start));
            return loneKeys.get(0);
        }
        return object;
    }

    // "k1": "k2": v  ->  "k1": {"k2": v}
    private Object chainedValue() {
        Object value = value();
        scanner.consumeWhitespace();
        if (scanner.peek() != ':') {
            return value;
        }
        if (!(value instanceof String)) {
            throw scanner.fail("Unexpected ':' after a non-string value");
        }
        int at = scanner.position();
        scanner.consume();
        recordWarning(String.format("Collapsed key chain at offset %d nested under \"%s\"", at, value));
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put((String) value, chainedValue());
        return nested;
    }

    private Object bareValue() {
        int start = scanner.position();
        String token = scanner.consumeWhile(c -> Character.isLetterOrDigit(c) || "._+-*/()% ".indexOf(c) >= 0).strip();
        if (token.isEmpty()) {
            throw scanner.fail("Expected a JSON value, got " + scanner.describeCurrent());
        }
        Object notLiteral = new Object();
        Object literal = Values.coerceBareword(token, notLiteral);
        if (literal != notLiteral) {
            return literal;
        }
        if (ArithmeticEvaluator.isArithmetic(token)) {
            Number result;
            try {
                result = ArithmeticEvaluator.evaluate(token);
            } catch (DSLSyntaxException e) {
                throw scanner.failAt(String.format("Invalid arithmetic expression '%s': %s", token, e.getMessage()), start);
            }
            recordWarning(String.format("Arithmetic literal '%s' at offset %d evaluated to %s", token, start, result));
            return result;
        }
        throw scanner.failAt(String.format("Invalid value '%s'", token), start);
    }

    private void recordWarning(String message) {
        warnings.add(message);
        log.warning(message);
    }
}
