package io.github.cyfko.curatorkit.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static factories and structural queries for criterion trees.
 *
 * <pre>{@code
 * Criterion tree = Criteria.not(Criteria.or(
 *         Criteria.leaf("histology", "histology_type", "sarcomatoid"),
 *         Criteria.leaf("histology", "histology_type", "spindle cell")));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Criteria {

    private Criteria() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Creates a leaf from alternating field names and values.
     *
     * @param typeName      leaf type
     * @param namesAndValues {@code name1, value1, name2, value2, ...}
     * @return the new leaf
     * @throws IllegalArgumentException if the arguments are not name/value pairs
     */
    public static LeafCriterion leaf(String typeName, Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Field names and values must come in pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String)) {
                throw new IllegalArgumentException("Field name at position " + i + " must be a string");
            }
            fields.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return new LeafCriterion(typeName, fields);
    }

    public static AndCriterion and(Criterion... children) {
        return new AndCriterion(children);
    }

    public static OrCriterion or(Criterion... children) {
        return new OrCriterion(children);
    }

    public static NotCriterion not(Criterion child) {
        return new NotCriterion(child);
    }

    public static IfCriterion ifThen(Criterion condition, Criterion thenBranch) {
        return new IfCriterion(condition, thenBranch);
    }

    public static IfCriterion ifThenElse(Criterion condition, Criterion thenBranch, Criterion elseBranch) {
        return new IfCriterion(condition, thenBranch, elseBranch);
    }

    /**
     * Creates a timing node from alternating field names and values, see {@link #leaf}.
     *
     * @param child          the timed criterion
     * @param namesAndValues {@code name1, value1, name2, value2, ...}
     * @return the new timing node
     */
    public static TimingCriterion timing(Criterion child, Object... namesAndValues) {
        return new TimingCriterion(leaf("timing", namesAndValues).fields(), child);
    }

    /**
     * Reports whether the tree contains a negation directly wrapping another negation.
     * <p>
     * Parsers keep {@code not{not{x}}} as written; a later semantic pass decides whether
     * to simplify it.
     * </p>
     *
     * @param root tree root
     * @return true if some {@code not} node has a {@code not} child
     */
    public static boolean hasDoubleNegation(Criterion root) {
        return switch (root.kind()) {
            case LEAF -> false;
            case NOT -> {
                Criterion child = ((NotCriterion) root).child();
                yield child.kind() == CriterionKind.NOT || hasDoubleNegation(child);
            }
            case AND, OR -> ((ListCriterion) root).children().stream().anyMatch(Criteria::hasDoubleNegation);
            case TIMING -> hasDoubleNegation(((TimingCriterion) root).child());
            case IF -> {
                IfCriterion ifNode = (IfCriterion) root;
                yield hasDoubleNegation(ifNode.condition())
                        || hasDoubleNegation(ifNode.thenBranch())
                        || (ifNode.elseBranch() != null && hasDoubleNegation(ifNode.elseBranch()));
            }
        };
    }

    /**
     * @param roots forest roots
     * @return deep copies of every root, in order
     */
    public static List<Criterion> deepCopy(List<Criterion> roots) {
        List<Criterion> copy = new ArrayList<>(roots.size());
        for (Criterion root : roots) {
            copy.add(root.deepCopy());
        }
        return copy;
    }
}
