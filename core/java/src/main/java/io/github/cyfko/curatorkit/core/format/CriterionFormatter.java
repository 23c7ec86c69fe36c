package io.github.cyfko.curatorkit.core.format;

import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.IfCriterion;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.model.ListCriterion;
import io.github.cyfko.curatorkit.core.model.NotCriterion;
import io.github.cyfko.curatorkit.core.model.TimingCriterion;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes criterion trees back to Criterion DSL text.
 * <p>
 * The output parses back, with {@link io.github.cyfko.curatorkit.core.impl.CriterionDslParser},
 * to a tree equal to the formatted one. Strings are written double-quoted with JSON escapes,
 * numbers and booleans bare, {@code null} as {@code null}, and a nested leaf as
 * {@code key=type(...)}.
 * </p>
 *
 * <pre>{@code
 * CriterionFormatter.format(tree);
 * // and{
 * //     age(min=18),
 * //     not{
 * //         histology(histology_type="sarcomatoid")
 * //     }
 * // }
 * CriterionFormatter.formatCompact(tree);
 * // and{age(min=18), not{histology(histology_type="sarcomatoid")}}
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CriterionFormatter {

    private static final String INDENT = "    ";

    private CriterionFormatter() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Multi-line form: one child per line, four spaces per depth level. Leaves stay on one line.
     *
     * @param node the tree
     * @return the Criterion DSL text
     */
    public static String format(Criterion node) {
        StringBuilder out = new StringBuilder();
        writePretty(node, 0, out);
        return out.toString();
    }

    /**
     * @param roots the roots of a forest
     * @return each root in {@link #format(Criterion)} form, one after the other
     */
    public static String formatForest(List<? extends Criterion> roots) {
        StringBuilder out = new StringBuilder();
        for (Criterion root : roots) {
            if (out.length() > 0) {
                out.append('\n');
            }
            writePretty(root, 0, out);
        }
        return out.toString();
    }

    /**
     * Single-line form.
     *
     * @param node the tree
     * @return the Criterion DSL text
     */
    public static String formatCompact(Criterion node) {
        StringBuilder out = new StringBuilder();
        writeCompact(node, out);
        return out.toString();
    }

    private static void writePretty(Criterion node, int depth, StringBuilder out) {
        switch (node.kind()) {
            case LEAF -> writeLeaf((LeafCriterion) node, out);
            case AND, OR -> {
                List<Criterion> children = ((ListCriterion) node).children();
                out.append(node.typeName()).append('{');
                if (children.isEmpty()) {
                    out.append('}');
                    return;
                }
                for (int i = 0; i < children.size(); i++) {
                    out.append(i == 0 ? "\n" : ",\n");
                    indent(depth + 1, out);
                    writePretty(children.get(i), depth + 1, out);
                }
                out.append('\n');
                indent(depth, out);
                out.append('}');
            }
            case NOT -> writePrettyBlock("not", ((NotCriterion) node).child(), depth, out);
            case TIMING -> {
                TimingCriterion timing = (TimingCriterion) node;
                writePrettyBlock(timingHead(timing), timing.child(), depth, out);
            }
            case IF -> {
                IfCriterion ifNode = (IfCriterion) node;
                writePrettyBlock("if", ifNode.condition(), depth, out);
                out.append(' ');
                writePrettyBlock("then", ifNode.thenBranch(), depth, out);
                if (ifNode.elseBranch() != null) {
                    out.append(' ');
                    writePrettyBlock("else", ifNode.elseBranch(), depth, out);
                }
            }
        }
    }

    private static void writePrettyBlock(String keyword, Criterion child, int depth, StringBuilder out) {
        out.append(keyword).append("{\n");
        indent(depth + 1, out);
        writePretty(child, depth + 1, out);
        out.append('\n');
        indent(depth, out);
        out.append('}');
    }

    private static void writeCompact(Criterion node, StringBuilder out) {
        switch (node.kind()) {
            case LEAF -> writeLeaf((LeafCriterion) node, out);
            case AND, OR -> {
                out.append(node.typeName()).append('{');
                Iterator<Criterion> children = ((ListCriterion) node).children().iterator();
                while (children.hasNext()) {
                    writeCompact(children.next(), out);
                    if (children.hasNext()) {
                        out.append(", ");
                    }
                }
                out.append('}');
            }
            case NOT -> {
                out.append("not{");
                writeCompact(((NotCriterion) node).child(), out);
                out.append('}');
            }
            case TIMING -> {
                TimingCriterion timing = (TimingCriterion) node;
                out.append(timingHead(timing)).append('{');
                writeCompact(timing.child(), out);
                out.append('}');
            }
            case IF -> {
                IfCriterion ifNode = (IfCriterion) node;
                out.append("if{");
                writeCompact(ifNode.condition(), out);
                out.append("} then{");
                writeCompact(ifNode.thenBranch(), out);
                out.append('}');
                if (ifNode.elseBranch() != null) {
                    out.append(" else{");
                    writeCompact(ifNode.elseBranch(), out);
                    out.append('}');
                }
            }
        }
    }

    // timing(k=v, ...) or a bare timing when it carries no fields
    private static String timingHead(TimingCriterion timing) {
        StringBuilder head = new StringBuilder(timing.typeName());
        if (!timing.fields().isEmpty()) {
            writeFields(timing.fields(), head);
        }
        return head.toString();
    }

    private static void writeLeaf(LeafCriterion leaf, StringBuilder out) {
        out.append(leaf.typeName());
        writeFields(leaf.fields(), out);
    }

    private static void writeFields(Map<String, Object> values, StringBuilder out) {
        out.append('(');
        Iterator<Map.Entry<String, Object>> fields = values.entrySet().iterator();
        while (fields.hasNext()) {
            Map.Entry<String, Object> field = fields.next();
            out.append(field.getKey()).append('=');
            writeValue(field.getValue(), out);
            if (fields.hasNext()) {
                out.append(", ");
            }
        }
        out.append(')');
    }

    private static void writeValue(Object value, StringBuilder out) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof String) {
            writeString((String) value, out);
        } else if (value instanceof LeafCriterion) {
            writeLeaf((LeafCriterion) value, out);
        } else if (value instanceof List<?>) {
            out.append('[');
            Iterator<?> items = ((List<?>) value).iterator();
            while (items.hasNext()) {
                writeValue(items.next(), out);
                if (items.hasNext()) {
                    out.append(", ");
                }
            }
            out.append(']');
        } else {
            out.append(value);
        }
    }

    static void writeString(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static void indent(int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth));
    }
}
