package io.github.cyfko.curatorkit.core.impl;

import io.github.cyfko.curatorkit.core.api.DslParser;
import io.github.cyfko.curatorkit.core.config.ParserPolicy;
import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;
import io.github.cyfko.curatorkit.core.exception.TreeInvariantException;
import io.github.cyfko.curatorkit.core.model.AndCriterion;
import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.model.ListCriterion;
import io.github.cyfko.curatorkit.core.model.NotCriterion;
import io.github.cyfko.curatorkit.core.model.OrCriterion;
import io.github.cyfko.curatorkit.core.model.Values;
import io.github.cyfko.curatorkit.core.parsing.Scanner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Recursive-descent parser for the Rule DSL, the bracket/paren expression language rule
 * mappings are written in.
 *
 * <h2>Grammar</h2>
 * <pre>
 * rule      := composite | name [ "[" [args] "]" | "(" [args] ")" ]
 * composite := ("AND" | "OR") "(" [rule {"," rule}] ")"
 *            | "NOT" "(" rule ")"
 * args      := value {"," value}
 * value     := quoted_string | "[" [args] "]" | bareword
 * </pre>
 * <ul>
 *   <li>{@code AND} and {@code OR} accept zero or more children.</li>
 *   <li>{@code NOT} accepts exactly one child; anything else fails at parse time.</li>
 *   <li>A bare name without arguments is a zero-argument rule.</li>
 *   <li>Strings may be single or double quoted.</li>
 *   <li>Barewords are coerced to {@code true}, {@code false}, {@code null}, an integer or a
 *       decimal; any other bareword is a syntax error.</li>
 * </ul>
 * <p>
 * Each rule becomes a {@link LeafCriterion} named after the rule whose {@value #ARGS_FIELD}
 * field holds the argument list.
 * </p>
 *
 * <pre>{@code
 * Criterion tree = new RuleDslParser().parse("""
 *     AND(
 *         NOT(HAS_TOTAL_BILIRUBIN_ULN_OF_AT_MOST_X[1.5]),
 *         HAS_ANY_X_AND_Y['LEFT', 'RIGHT'],
 *         IS_MALE
 *     )""");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RuleDslParser implements DslParser {

    private static final Logger log = Logger.getLogger(RuleDslParser.class.getName());

    /** Name of the leaf field holding a rule's argument list. */
    public static final String ARGS_FIELD = "args";

    private final ParserPolicy policy;

    public RuleDslParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param policy limits applied while parsing
     * @throws IllegalArgumentException if policy is null
     */
    public RuleDslParser(ParserPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.policy = policy;
    }

    @Override
    public Criterion parse(String text) throws DSLSyntaxException {
        if (text == null || text.isBlank()) {
            throw new DSLSyntaxException("Rule text cannot be null or empty");
        }
        Scanner scanner = new Scanner(text, policy);
        Criterion rule = rule(scanner);
        scanner.consumeWhitespace();
        if (!scanner.isEof()) {
            throw scanner.fail("Unexpected trailing input " + scanner.describeCurrent() + " after rule");
        }
        return rule;
    }

    @Override
    public List<Criterion> parseForest(String text) throws DSLSyntaxException {
        if (text == null) {
            throw new DSLSyntaxException("Rule text cannot be null");
        }
        Scanner scanner = new Scanner(text, policy);
        List<Criterion> rules = new ArrayList<>();
        scanner.consumeWhitespace();
        while (!scanner.isEof()) {
            rules.add(rule(scanner));
            scanner.consumeWhitespace();
            if (scanner.peek() == ',') {
                scanner.consume();
                scanner.consumeWhitespace();
            }
        }
        return rules;
    }

    /**
     * Converts a rule tree into its dictionary form: {@code {"AND": [...]}}, {@code {"OR": [...]}},
     * {@code {"NOT": {...}}} and {@code {"RULE_NAME": [args]}} for a rule.
     *
     * @param rule a tree produced by this parser (or built with the same shape)
     * @return an ordered map with exactly one entry
     * @throws TreeInvariantException if the tree contains an {@code if} node
     */
    public static Map<String, Object> toMap(Criterion rule) {
        Map<String, Object> map = new LinkedHashMap<>();
        switch (rule.kind()) {
            case AND, OR -> {
                List<Object> subrules = new ArrayList<>();
                for (Criterion child : ((ListCriterion) rule).children()) {
                    subrules.add(toMap(child));
                }
                map.put(rule.kind().name(), subrules);
            }
            case NOT -> map.put("NOT", toMap(((NotCriterion) rule).child()));
            case LEAF -> {
                Object args = ((LeafCriterion) rule).get(ARGS_FIELD);
                map.put(rule.typeName(), args instanceof List<?> ? args : new ArrayList<>());
            }
            case IF -> throw new TreeInvariantException("Rules have no conditional form; cannot convert an 'if' node");
            case TIMING -> throw new TreeInvariantException("Rules have no timing form; cannot convert a 'timing' node");
        }
        return map;
    }

    /**
     * Rebuilds a rule tree from its dictionary form, as produced by {@link #toMap(Criterion)} or
     * recovered from model output. A bare string is a zero-argument rule, which is what a
     * lone-key object such as {@code { "IS_MALE" }} recovers to.
     *
     * @param value a single-entry map, or a rule name
     * @return the rule tree
     * @throws DSLSyntaxException if the value does not have the dictionary shape
     */
    public static Criterion fromMap(Object value) {
        if (value instanceof String) {
            return new LeafCriterion((String) value, Map.of(ARGS_FIELD, new ArrayList<>()));
        }
        if (!(value instanceof Map<?, ?>) || ((Map<?, ?>) value).size() != 1) {
            throw new DSLSyntaxException("Expected a rule object with exactly one entry, got " + value);
        }
        Map.Entry<?, ?> entry = ((Map<?, ?>) value).entrySet().iterator().next();
        String name = String.valueOf(entry.getKey());
        Object body = entry.getValue();

        switch (name) {
            case "AND", "OR" -> {
                if (!(body instanceof List<?>)) {
                    throw new DSLSyntaxException(String.format("Expected a list of subrules under '%s', got %s", name, body));
                }
                List<Criterion> subrules = new ArrayList<>();
                for (Object item : (List<?>) body) {
                    subrules.add(fromMap(item));
                }
                return "AND".equals(name) ? new AndCriterion(subrules) : new OrCriterion(subrules);
            }
            case "NOT" -> {
                if (body instanceof List<?>) {
                    List<?> items = (List<?>) body;
                    if (items.size() != 1) {
                        throw new DSLSyntaxException(String.format("Expected 1 child in 'NOT', got %d", items.size()));
                    }
                    return new NotCriterion(fromMap(items.get(0)));
                }
                return new NotCriterion(fromMap(body));
            }
            default -> {
                List<Object> args = new ArrayList<>();
                if (body instanceof List<?>) {
                    args.addAll((List<?>) body);
                } else if (body instanceof Boolean) {
                    // "HAS_X": true means the rule applies, it has no boolean argument
                    log.fine(() -> String.format("Dropping boolean body of rule '%s'", name));
                } else if (body != null) {
                    args.add(body);
                }
                try {
                    return new LeafCriterion(name, Map.of(ARGS_FIELD, args));
                } catch (IllegalArgumentException e) {
                    throw new DSLSyntaxException(String.format("Invalid arguments for rule '%s': %s", name, args), e);
                }
            }
        }
    }

    private Criterion rule(Scanner scanner) {
        scanner.consumeWhitespace();
        int start = scanner.position();
        String name = scanner.consumeIdentifier();
        if (name.isEmpty()) {
            throw scanner.fail("Expected a rule name, got " + scanner.describeCurrent());
        }
        if (!policy.identifierPattern().matcher(name).matches()) {
            throw scanner.failAt(String.format("Invalid rule name '%s'", name), start);
        }
        scanner.consumeWhitespace();

        switch (name) {
            case "AND", "OR", "NOT" -> {
                if (scanner.peek() != '(') {
                    throw scanner.fail(String.format("Expected '(' after '%s', got %s", name, scanner.describeCurrent()));
                }
                List<Criterion> subrules = new ArrayList<>();
                scanner.consumeDelimited('(', ')', () -> subrules.add(rule(scanner)), null);
                if ("NOT".equals(name)) {
                    if (subrules.size() != 1) {
                        throw scanner.failAt(String.format("Expected 1 child in 'NOT', got %d", subrules.size()), start);
                    }
                    return new NotCriterion(subrules.get(0));
                }
                return "AND".equals(name) ? new AndCriterion(subrules) : new OrCriterion(subrules);
            }
            default -> {
                List<Object> args = new ArrayList<>();
                char next = scanner.peek();
                if (next == '[') {
                    scanner.consumeDelimited('[', ']', () -> args.add(value(scanner)), null);
                } else if (next == '(') {
                    scanner.consumeDelimited('(', ')', () -> args.add(value(scanner)), null);
                }
                return new LeafCriterion(name, Map.of(ARGS_FIELD, args));
            }
        }
    }

    private Object value(Scanner scanner) {
        scanner.consumeWhitespace();
        char c = scanner.peek();
        if (c == '\'' || c == '"') {
            return scanner.consumeQuotedString(c);
        }
        if (c == '[') {
            List<Object> items = new ArrayList<>();
            scanner.consumeDelimited('[', ']', () -> items.add(value(scanner)), null);
            return items;
        }

        int start = scanner.position();
        String token = scanner.consumeWhile(ch -> Character.isLetterOrDigit(ch) || ch == '.' || ch == '_' || ch == '-' || ch == '+');
        if (token.isEmpty()) {
            throw scanner.fail("Expected a value, got " + scanner.describeCurrent());
        }
        Object invalid = new Object();
        Object value = Values.coerceBareword(token, invalid);
        if (value == invalid) {
            throw scanner.failAt(String.format(
                    "Invalid value '%s': expected a quoted string, number, boolean, null or list", token), start);
        }
        return value;
    }
}
