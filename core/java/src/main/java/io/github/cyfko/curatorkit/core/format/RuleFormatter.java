package io.github.cyfko.curatorkit.core.format;

import io.github.cyfko.curatorkit.core.exception.TreeInvariantException;
import io.github.cyfko.curatorkit.core.impl.RuleDslParser;
import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.model.ListCriterion;
import io.github.cyfko.curatorkit.core.model.NotCriterion;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Writes criterion trees as Rule DSL text, one operand per line:
 * <pre>
 * AND
 * (
 *     IS_MALE,
 *     HAS_ANY_STAGE_X['Grade 4'],
 *     NOT
 *     (
 *         HAS_KNOWN_HIV_INFECTION
 *     )
 * )
 * </pre>
 * <p>
 * A rule without arguments is written as its bare name. Strings are single-quoted unless
 * they contain a single quote and no double quote. The output parses back with
 * {@link RuleDslParser}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RuleFormatter {

    private static final String INDENT = "    ";

    private RuleFormatter() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param node a tree made of {@code and}, {@code or}, {@code not} and rule leaves
     * @return the Rule DSL text
     * @throws TreeInvariantException if the tree has an {@code if}, which the Rule DSL cannot express
     */
    public static String format(Criterion node) {
        StringBuilder out = new StringBuilder();
        write(node, 0, out);
        return out.toString();
    }

    private static void write(Criterion node, int level, StringBuilder out) {
        switch (node.kind()) {
            case LEAF -> writeRule((LeafCriterion) node, out);
            case AND, OR -> writeBlock(node.typeName().toUpperCase(Locale.ROOT), ((ListCriterion) node).children(), level, out);
            case NOT -> writeBlock("NOT", List.of(((NotCriterion) node).child()), level, out);
            case IF -> throw new TreeInvariantException("The Rule DSL has no conditional form; cannot format an 'if'");
            case TIMING -> throw new TreeInvariantException("The Rule DSL has no timing form; cannot format a 'timing'");
        }
    }

    private static void writeBlock(String keyword, List<Criterion> operands, int level, StringBuilder out) {
        String indent = INDENT.repeat(level);
        String nextIndent = INDENT.repeat(level + 1);
        out.append(keyword).append('\n').append(indent).append("(\n").append(nextIndent);
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                out.append(",\n").append(nextIndent);
            }
            write(operands.get(i), level + 1, out);
        }
        out.append('\n').append(indent).append(')');
    }

    private static void writeRule(LeafCriterion rule, StringBuilder out) {
        out.append(rule.typeName());
        List<Object> args = argumentsOf(rule);
        if (!args.isEmpty()) {
            writeList(args, out);
        }
    }

    // a parsed rule keeps its arguments under a single list field; other leaves list their field values
    private static List<Object> argumentsOf(LeafCriterion rule) {
        Object args = rule.get(RuleDslParser.ARGS_FIELD);
        if (rule.fields().size() == 1 && args instanceof List<?>) {
            return new ArrayList<>((List<?>) args);
        }
        return new ArrayList<>(rule.fields().values());
    }

    private static void writeValue(Object value, StringBuilder out) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof String) {
            writeString((String) value, out);
        } else if (value instanceof List<?>) {
            writeList((List<?>) value, out);
        } else if (value instanceof LeafCriterion) {
            writeRule((LeafCriterion) value, out);
        } else {
            out.append(value);
        }
    }

    private static void writeList(List<?> values, StringBuilder out) {
        out.append('[');
        Iterator<?> items = values.iterator();
        while (items.hasNext()) {
            writeValue(items.next(), out);
            if (items.hasNext()) {
                out.append(", ");
            }
        }
        out.append(']');
    }

    private static void writeString(String value, StringBuilder out) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        out.append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == quote || c == '\\') {
                out.append('\\').append(c);
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\t') {
                out.append("\\t");
            } else if (c == '\r') {
                out.append("\\r");
            } else {
                out.append(c);
            }
        }
        out.append(quote);
    }
}
