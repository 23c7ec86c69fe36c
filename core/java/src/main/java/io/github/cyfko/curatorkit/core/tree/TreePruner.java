package io.github.cyfko.curatorkit.core.tree;

import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.Document;
import io.github.cyfko.curatorkit.core.model.IfCriterion;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.model.ListCriterion;
import io.github.cyfko.curatorkit.core.model.SingleChildCriterion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Keeps only the branches of a tree that contain a node of a target type.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A leaf survives iff its type is a target.</li>
 *   <li>An {@code and}/{@code or} keeps its surviving children and survives iff one of them
 *       survives or its own type is a target.</li>
 *   <li>A {@code not} or {@code timing} survives iff its child survives or its own type is a
 *       target.</li>
 *   <li>An {@code if} survives iff one of its branches contains a target or its own type is
 *       a target. Target-free condition and then-branch are kept untouched; a target-free
 *       else-branch is dropped.</li>
 *   <li>A node that does not survive is left unmodified.</li>
 * </ul>
 * <p>
 * At forest level, roots that do not survive are removed. Pruning twice with the same
 * targets gives the same tree as pruning once.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TreePruner {

    private static final Logger log = Logger.getLogger(TreePruner.class.getName());

    private TreePruner() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Prunes one tree in place.
     *
     * @param root    the tree root
     * @param targets target type names
     * @return true if the root survives
     */
    public static boolean prune(Criterion root, Set<String> targets) {
        return prune(root, targets, containsMap(List.of(root), targets));
    }

    /**
     * Prunes every root of a forest in place and removes the roots that do not survive.
     *
     * @param forest  the mutable list of roots
     * @param targets target type names
     */
    public static void pruneForest(List<Criterion> forest, Set<String> targets) {
        Map<Criterion, Boolean> contains = containsMap(forest, targets);
        List<Criterion> survivors = new ArrayList<>(forest.size());
        for (Criterion root : forest) {
            if (prune(root, targets, contains)) {
                survivors.add(root);
            }
        }
        forest.clear();
        forest.addAll(survivors);
    }

    /**
     * @param document the document to prune in place
     * @param targets  target type names
     * @return true if the document has no root left and can be discarded
     */
    public static boolean pruneDocument(Document document, Set<String> targets) {
        int before = document.roots().size();
        pruneForest(document.roots(), targets);
        log.fine(() -> String.format("Pruned document '%s': %d of %d root(s) kept",
                document.id(), document.roots().size(), before));
        return document.isDiscardable();
    }

    /**
     * @param documents the documents to prune in place
     * @param targets   target type names
     * @return the ids of the documents left without roots, in order
     */
    public static List<String> pruneDocuments(Collection<Document> documents, Set<String> targets) {
        List<String> discardable = new ArrayList<>();
        for (Document document : documents) {
            if (pruneDocument(document, targets)) {
                discardable.add(document.id());
            }
        }
        return discardable;
    }

    /**
     * @param documents candidate documents
     * @param targets   target type names
     * @return the documents containing at least one node of a target type, in order
     */
    public static List<Document> filterDocuments(Collection<Document> documents, Set<String> targets) {
        List<Document> kept = new ArrayList<>();
        for (Document document : documents) {
            if (TreeWalker.containsType(document.roots(), targets)) {
                kept.add(document);
            }
        }
        return kept;
    }

    /**
     * Removes a field, such as a free-text description, from every leaf of every document,
     * nested leaves included.
     *
     * @param documents the documents to clean in place
     * @param field     the field name
     */
    public static void removeField(Collection<Document> documents, String field) {
        TreeWalker.walkDocuments(documents, visit -> {
            if (visit.node().isLeaf()) {
                removeField((LeafCriterion) visit.node(), field);
            }
        });
    }

    private static void removeField(LeafCriterion leaf, String field) {
        leaf.fields().remove(field);
        for (Object value : leaf.fields().values()) {
            if (value instanceof LeafCriterion) {
                removeField((LeafCriterion) value, field);
            }
        }
    }

    private static boolean prune(Criterion node, Set<String> targets, Map<Criterion, Boolean> contains) {
        if (!contains.getOrDefault(node, false)) {
            return false;
        }
        boolean isTarget = targets.contains(node.typeName());
        return switch (node.kind()) {
            case LEAF -> isTarget;
            case AND, OR -> {
                List<Criterion> children = ((ListCriterion) node).children();
                List<Criterion> survivors = new ArrayList<>(children.size());
                for (Criterion child : children) {
                    if (prune(child, targets, contains)) {
                        survivors.add(child);
                    }
                }
                children.clear();
                children.addAll(survivors);
                yield isTarget || !survivors.isEmpty();
            }
            case NOT, TIMING -> prune(((SingleChildCriterion) node).child(), targets, contains) || isTarget;
            case IF -> {
                IfCriterion ifNode = (IfCriterion) node;
                prune(ifNode.condition(), targets, contains);
                prune(ifNode.thenBranch(), targets, contains);
                if (ifNode.elseBranch() != null && !prune(ifNode.elseBranch(), targets, contains)) {
                    ifNode.setElseBranch(null);
                }
                yield true;
            }
        };
    }

    // node -> "its subtree has a node of a target type", computed once per pruning run
    private static Map<Criterion, Boolean> containsMap(List<Criterion> forest, Set<String> targets) {
        Map<Criterion, Boolean> contains = TreeWalker.newIdentityMap();
        for (Criterion root : forest) {
            fill(root, targets, contains);
        }
        return contains;
    }

    private static boolean fill(Criterion node, Set<String> targets, Map<Criterion, Boolean> contains) {
        Boolean known = contains.get(node);
        if (known != null) {
            return known;
        }
        contains.put(node, false);
        boolean found = targets.contains(node.typeName());
        for (Criterion child : TreeWalker.children(node)) {
            found |= fill(child, targets, contains);
        }
        contains.put(node, found);
        return found;
    }
}
