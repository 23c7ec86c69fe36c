package io.github.cyfko.curatorkit.core.tree;

import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.Document;
import io.github.cyfko.curatorkit.core.model.IfCriterion;
import io.github.cyfko.curatorkit.core.model.ListCriterion;
import io.github.cyfko.curatorkit.core.model.SingleChildCriterion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Depth-first, pre-order traversal of criterion trees, forests and documents.
 * <p>
 * Children are visited slot by slot, in {@link ChildSlot} order: the list of an
 * {@code and}/{@code or}, the child of a {@code not}, then the condition, then-branch and
 * else-branch of an {@code if}.
 * </p>
 *
 * <h2>Cycles</h2>
 * <p>
 * Well-formed trees have no cycles and share no node, but the walker does not rely on it:
 * a node reached a second time within one tree is skipped and logged at FINE.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<NodeVisit> rows = TreeWalker.tabulate(document.roots());
 * boolean relevant = TreeWalker.containsType(document.roots(), Set.of("histology"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TreeWalker {

    private static final Logger log = Logger.getLogger(TreeWalker.class.getName());

    private TreeWalker() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Returns the children of a node, in visiting order.
     *
     * @param node any node
     * @return the children, empty for a leaf
     */
    public static List<Criterion> children(Criterion node) {
        return switch (node.kind()) {
            case LEAF -> List.of();
            case AND, OR -> Collections.unmodifiableList(((ListCriterion) node).children());
            case NOT, TIMING -> List.of(((SingleChildCriterion) node).child());
            case IF -> {
                IfCriterion ifNode = (IfCriterion) node;
                yield ifNode.elseBranch() == null
                        ? List.of(ifNode.condition(), ifNode.thenBranch())
                        : List.of(ifNode.condition(), ifNode.thenBranch(), ifNode.elseBranch());
            }
        };
    }

    /**
     * Finds the slot a child occupies in its parent, by identity.
     *
     * @param parent the parent node
     * @param child  the child node
     * @return the slot, or {@code null} if the node is not a child of the parent
     */
    public static ChildSlot slotOf(Criterion parent, Criterion child) {
        return switch (parent.kind()) {
            case LEAF -> null;
            case AND, OR -> indexOf(((ListCriterion) parent).children(), child) >= 0 ? ChildSlot.CRITERIA : null;
            case NOT, TIMING -> ((SingleChildCriterion) parent).child() == child ? ChildSlot.CRITERION : null;
            case IF -> {
                IfCriterion ifNode = (IfCriterion) parent;
                if (ifNode.condition() == child) {
                    yield ChildSlot.CONDITION;
                }
                if (ifNode.thenBranch() == child) {
                    yield ChildSlot.THEN;
                }
                yield ifNode.elseBranch() == child ? ChildSlot.ELSE : null;
            }
        };
    }

    /**
     * Walks one tree.
     *
     * @param root    the tree root
     * @param visitor called once per node, parents before children
     */
    public static void walkNode(Criterion root, Consumer<NodeVisit> visitor) {
        walk(null, root, new ArrayList<>(), newIdentitySet(), visitor);
    }

    /**
     * Walks every root of a forest in order.
     *
     * @param forest  the roots
     * @param visitor called once per node
     */
    public static void walkForest(List<? extends Criterion> forest, Consumer<NodeVisit> visitor) {
        for (Criterion root : forest) {
            walk(null, root, new ArrayList<>(), newIdentitySet(), visitor);
        }
    }

    /**
     * Walks the forest of every document; each visit carries its document.
     *
     * @param documents the documents
     * @param visitor   called once per node
     */
    public static void walkDocuments(Collection<Document> documents, Consumer<NodeVisit> visitor) {
        for (Document document : documents) {
            for (Criterion root : document.roots()) {
                walk(document, root, new ArrayList<>(), newIdentitySet(), visitor);
            }
        }
    }

    /**
     * Walks documents for rewriting: every visit is collected first, then handed to the
     * visitor, so the visitor may replace or remove the visited node. A visit whose node has
     * been detached from its document by an earlier rewrite is skipped.
     *
     * @param documents the documents to rewrite
     * @param visitor   called once per still-attached node
     */
    public static void walkForRewrite(Collection<Document> documents, Consumer<NodeVisit> visitor) {
        List<NodeVisit> visits = new ArrayList<>();
        walkDocuments(documents, visits::add);
        for (NodeVisit visit : visits) {
            if (isAttached(visit)) {
                visitor.accept(visit);
            } else {
                log.fine(() -> String.format("Skipping '%s' detached from document '%s' by an earlier rewrite",
                        visit.node().typeName(), visit.document().id()));
            }
        }
    }

    /**
     * Read-mode walk recording every node of a forest.
     *
     * @param forest the roots
     * @return one visit per node, in pre-order
     */
    public static List<NodeVisit> tabulate(List<? extends Criterion> forest) {
        List<NodeVisit> rows = new ArrayList<>();
        walkForest(forest, rows::add);
        return rows;
    }

    /**
     * Read-mode walk recording every node of every document.
     *
     * @param documents the documents
     * @return one visit per node, in document order then pre-order
     */
    public static List<NodeVisit> tabulateDocuments(Collection<Document> documents) {
        List<NodeVisit> rows = new ArrayList<>();
        walkDocuments(documents, rows::add);
        return rows;
    }

    /**
     * @param forest the roots
     * @param types  type names to look for, see {@link Criterion#typeName()}
     * @return true if any node of the forest has one of the types
     */
    public static boolean containsType(List<? extends Criterion> forest, Set<String> types) {
        Set<Criterion> seen = newIdentitySet();
        for (Criterion root : forest) {
            if (containsType(root, types, seen)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param root  a tree root
     * @param types type names to look for
     * @return true if any node of the tree has one of the types
     */
    public static boolean containsType(Criterion root, Set<String> types) {
        return containsType(root, types, newIdentitySet());
    }

    /**
     * Checks that every link of the visit's path is still in place.
     *
     * @param visit a visit recorded earlier
     * @return true if the node is still reachable from its document (or root) along the path
     */
    public static boolean isAttached(NodeVisit visit) {
        List<Criterion> chain = new ArrayList<>(visit.path());
        chain.add(visit.node());
        if (visit.document() != null && indexOf(visit.document().roots(), chain.get(0)) < 0) {
            return false;
        }
        for (int i = 1; i < chain.size(); i++) {
            if (slotOf(chain.get(i - 1), chain.get(i)) == null) {
                return false;
            }
        }
        return true;
    }

    static int indexOf(List<? extends Criterion> list, Criterion node) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    static Set<Criterion> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static void walk(Document document, Criterion node, List<Criterion> path,
                             Set<Criterion> seen, Consumer<NodeVisit> visitor) {
        if (!seen.add(node)) {
            log.fine(() -> String.format("Node '%s' reached twice at depth %d, skipping it", node.typeName(), path.size()));
            return;
        }
        Criterion parent = path.isEmpty() ? null : path.get(path.size() - 1);
        visitor.accept(new NodeVisit(document, node, parent, path.size(), path));

        List<Criterion> children = new ArrayList<>(children(node));
        path.add(node);
        for (Criterion child : children) {
            walk(document, child, path, seen, visitor);
        }
        path.remove(path.size() - 1);
    }

    private static boolean containsType(Criterion node, Set<String> types, Set<Criterion> seen) {
        if (!seen.add(node)) {
            return false;
        }
        if (types.contains(node.typeName())) {
            return true;
        }
        for (Criterion child : children(node)) {
            if (containsType(child, types, seen)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Map keyed by node identity, for per-node bookkeeping during rewrites.
     */
    static <V> Map<Criterion, V> newIdentityMap() {
        return new IdentityHashMap<>();
    }
}
