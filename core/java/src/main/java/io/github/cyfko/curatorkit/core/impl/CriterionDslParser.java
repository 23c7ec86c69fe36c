package io.github.cyfko.curatorkit.core.impl;

import io.github.cyfko.curatorkit.core.api.DslParser;
import io.github.cyfko.curatorkit.core.config.ParserPolicy;
import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;
import io.github.cyfko.curatorkit.core.model.AndCriterion;
import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.CriterionKind;
import io.github.cyfko.curatorkit.core.model.IfCriterion;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.model.NotCriterion;
import io.github.cyfko.curatorkit.core.model.OrCriterion;
import io.github.cyfko.curatorkit.core.model.TimingCriterion;
import io.github.cyfko.curatorkit.core.model.Values;
import io.github.cyfko.curatorkit.core.parsing.Scanner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive-descent parser for the Criterion DSL, the curly-brace, call-style format
 * eligibility criteria are curated and re-serialized in.
 *
 * <h2>Grammar</h2>
 * <pre>
 * criterion := and_or | not_ | if_ | timing | call
 * and_or    := ("and"|"or") "{" [criterion {"," criterion}] "}"
 * not_      := "not" "{" criterion "}"
 * timing    := "timing" ["(" [arg {"," arg}] ")"] "{" criterion "}"
 * if_       := "if" "{" criterion "}" "then" "{" criterion "}" ["else" "{" criterion "}"]
 * call      := identifier "(" [arg {"," arg}] ")"
 * arg       := identifier "=" value
 *            | identifier "=" identifier "(" [arg {"," arg}] ")"   ; nested leaf of that type
 *            | identifier "(" [arg {"," arg}] ")"                  ; nested leaf named after the key
 * value     := string | number | "true" | "false" | "null" | "[" [value {"," value}] "]"
 * </pre>
 * <p>
 * Keywords are matched case-insensitively ({@code And{...}} is accepted). Numbers are
 * parsed as {@link Long} first, then as {@link Double}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CriterionDslParser parser = new CriterionDslParser();
 * Criterion tree = parser.parse("""
 *     and{
 *         age(min=18),
 *         not{prior_treatment(treatment=radiotherapy(site="brain"))}
 *     }""");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class CriterionDslParser implements DslParser {

    private final ParserPolicy policy;

    /**
     * Default constructor using {@link ParserPolicy#defaults()}.
     */
    public CriterionDslParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param policy limits applied while parsing
     * @throws IllegalArgumentException if policy is null
     */
    public CriterionDslParser(ParserPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.policy = policy;
    }

    @Override
    public Criterion parse(String text) throws DSLSyntaxException {
        if (text == null || text.isBlank()) {
            throw new DSLSyntaxException("Criterion text cannot be null or empty");
        }
        Reader reader = new Reader(new Scanner(text, policy));
        Criterion root = reader.criterion();
        reader.expectEnd();
        return root;
    }

    @Override
    public List<Criterion> parseForest(String text) throws DSLSyntaxException {
        if (text == null) {
            throw new DSLSyntaxException("Criterion text cannot be null");
        }
        Reader reader = new Reader(new Scanner(text, policy));
        List<Criterion> roots = new ArrayList<>();
        reader.scanner.consumeWhitespace();
        while (!reader.scanner.isEof()) {
            roots.add(reader.criterion());
            reader.scanner.consumeWhitespace();
            if (reader.scanner.peek() == ',') {
                reader.scanner.consume();
                reader.scanner.consumeWhitespace();
            }
        }
        return roots;
    }

    /**
     * One parse session over a single text.
     */
    private static final class Reader {
        private final Scanner scanner;

        Reader(Scanner scanner) {
            this.scanner = scanner;
        }

        Criterion criterion() {
            scanner.consumeWhitespace();
            int start = scanner.position();
            String name = scanner.consumeIdentifier();
            if (name.isEmpty()) {
                throw scanner.fail("Expected a criterion, got " + scanner.describeCurrent());
            }
            scanner.consumeWhitespace();

            CriterionKind keyword = keywordOf(name);
            if (keyword == CriterionKind.TIMING && scanner.peek() == '(') {
                Map<String, Object> fields = arguments();
                scanner.consumeWhitespace();
                if (scanner.peek() != '{') {
                    throw scanner.fail(String.format("Expected '{' after '%s(...)', got %s", name, scanner.describeCurrent()));
                }
                return new TimingCriterion(fields, bracedSingle("timing", start));
            }
            if (keyword != null && scanner.peek() == '{') {
                return composite(keyword, start);
            }
            if (scanner.peek() == '(') {
                checkIdentifier(name, start);
                return new LeafCriterion(name, arguments());
            }
            if (keyword != null) {
                throw scanner.fail(String.format("Expected '{' after '%s', got %s", name, scanner.describeCurrent()));
            }
            throw scanner.failAt(String.format(
                    "Unknown criterion '%s': expected 'and', 'or', 'not', 'if', 'timing' or a call like '%s(...)'", name, name), start);
        }

        void expectEnd() {
            scanner.consumeWhitespace();
            if (!scanner.isEof()) {
                throw scanner.fail("Unexpected trailing input " + scanner.describeCurrent() + " after criterion");
            }
        }

        private Criterion composite(CriterionKind kind, int start) {
            return switch (kind) {
                case AND -> new AndCriterion(bracedCriteria());
                case OR -> new OrCriterion(bracedCriteria());
                case NOT -> new NotCriterion(bracedSingle("not", start));
                case IF -> conditional(start);
                case TIMING -> new TimingCriterion(bracedSingle("timing", start));
                case LEAF -> throw new IllegalStateException("A leaf is not a composite");
            };
        }

        private Criterion conditional(int start) {
            Criterion condition = bracedSingle("if", start);

            int thenStart = scanner.position();
            String then = scanner.consumeIdentifier();
            if (!"then".equalsIgnoreCase(then)) {
                scanner.consumeWhitespace();
                throw scanner.failAt(String.format("Expected 'then' after 'if', got %s",
                        then.isEmpty() ? scanner.describeCurrent() : "'" + then + "'"), thenStart);
            }
            Criterion thenBranch = bracedSingle("then", thenStart);

            int elseStart = scanner.position();
            String word = scanner.consumeIdentifier();
            if ("else".equalsIgnoreCase(word)) {
                Criterion elseBranch = bracedSingle("else", elseStart);
                return new IfCriterion(condition, thenBranch, elseBranch);
            }
            scanner.reset(elseStart);
            return new IfCriterion(condition, thenBranch);
        }

        private List<Criterion> bracedCriteria() {
            List<Criterion> criteria = new ArrayList<>();
            scanner.consumeDelimited('{', '}', () -> criteria.add(criterion()), null);
            return criteria;
        }

        private Criterion bracedSingle(String keyword, int start) {
            List<Criterion> criteria = bracedCriteria();
            if (criteria.size() != 1) {
                throw scanner.failAt(String.format("Expected 1 child in '%s', got %d", keyword, criteria.size()), start);
            }
            return criteria.get(0);
        }

        private Map<String, Object> arguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            scanner.consumeDelimited('(', ')', () -> argument(args), null);
            return args;
        }

        private void argument(Map<String, Object> args) {
            int keyStart = scanner.position();
            String key = scanner.consumeIdentifier();
            if (key.isEmpty()) {
                throw scanner.fail("Expected an argument name, got " + scanner.describeCurrent());
            }
            checkIdentifier(key, keyStart);
            if (args.containsKey(key)) {
                throw scanner.failAt(String.format("Duplicate argument '%s'", key), keyStart);
            }
            scanner.consumeWhitespace();

            char next = scanner.peek();
            if (next == '=') {
                scanner.consume();
                scanner.consumeWhitespace();
                args.put(key, value());
            } else if (next == '(') {
                args.put(key, new LeafCriterion(key, arguments()));
            } else {
                throw scanner.fail(String.format("Expected '=' after '%s', got %s", key, scanner.describeCurrent()));
            }
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

            int start = scanner.position();
            String token = scanner.consumeWhile(ch -> Character.isLetterOrDigit(ch) || ch == '.' || ch == '_' || ch == '-' || ch == '+');
            if (token.isEmpty()) {
                throw scanner.fail("Expected a value, got " + scanner.describeCurrent());
            }

            int afterToken = scanner.position();
            scanner.consumeWhitespace();
            if (scanner.peek() == '(' && scanner.policy().identifierPattern().matcher(token).matches()) {
                return new LeafCriterion(token, arguments());
            }
            scanner.reset(afterToken);

            Object invalid = new Object();
            Object value = Values.coerceBareword(token, invalid);
            if (value == invalid) {
                throw scanner.failAt(String.format(
                        "Invalid value '%s': expected a string, number, boolean, null or list", token), start);
            }
            return value;
        }

        private void checkIdentifier(String name, int start) {
            if (!scanner.policy().identifierPattern().matcher(name).matches()) {
                throw scanner.failAt(String.format(
                        "Invalid identifier '%s'. Identifiers must start with a letter or underscore " +
                        "and contain only alphanumeric characters and underscores.", name), start);
            }
        }

        private static CriterionKind keywordOf(String name) {
            String lower = name.toLowerCase(Locale.ROOT);
            for (CriterionKind kind : CriterionKind.values()) {
                if (Objects.equals(kind.keyword(), lower)) {
                    return kind;
                }
            }
            return null;
        }
    }
}
