package io.github.cyfko.curatorkit.core.tree;

import io.github.cyfko.curatorkit.core.exception.TreeInvariantException;
import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.Document;
import io.github.cyfko.curatorkit.core.model.IfCriterion;
import io.github.cyfko.curatorkit.core.model.LeafCriterion;
import io.github.cyfko.curatorkit.core.model.ListCriterion;
import io.github.cyfko.curatorkit.core.model.SingleChildCriterion;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * In-place replacement and removal of nodes, including the Move-to rewrite.
 * <p>
 * A node is always located by identity in its parent's slot (list element, {@code not}
 * child, {@code if} condition/then/else) or, when the parent is {@code null}, among the
 * document's roots. Sibling leaves may be field-for-field equal, so equality is never used.
 * A node that cannot be located is a {@link TreeInvariantException}: the caller passed a
 * parent that does not own the node.
 * </p>
 *
 * <h2>Required slots</h2>
 * <p>
 * A {@code not} cannot lose its child, nor an {@code if} its condition or then-branch.
 * Removing such a child through {@link #remove(NodeVisit)} removes the parent instead,
 * climbing the visit path as far as needed. The three-argument
 * {@link #remove(Document, Criterion, Criterion)} has no path and rejects it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NodeReplacer {

    private static final Logger log = Logger.getLogger(NodeReplacer.class.getName());

    private NodeReplacer() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Puts {@code replacement} where {@code node} is.
     *
     * @param document    the document owning the forest
     * @param parent      the node's parent, {@code null} for a root
     * @param node        the node to replace
     * @param replacement the new node
     * @throws TreeInvariantException if the node is not a child of the parent
     */
    public static void replace(Document document, Criterion parent, Criterion node, Criterion replacement) {
        Objects.requireNonNull(document, "document cannot be null");
        Objects.requireNonNull(node, "node cannot be null");
        Objects.requireNonNull(replacement, "replacement cannot be null");

        if (parent == null) {
            List<Criterion> roots = document.roots();
            int index = TreeWalker.indexOf(roots, node);
            if (index < 0) {
                throw notFound(document, null, node);
            }
            roots.set(index, replacement);
            return;
        }

        ChildSlot slot = TreeWalker.slotOf(parent, node);
        if (slot == null) {
            throw notFound(document, parent, node);
        }
        switch (slot) {
            case CRITERIA -> {
                List<Criterion> children = ((ListCriterion) parent).children();
                children.set(TreeWalker.indexOf(children, node), replacement);
            }
            case CRITERION -> ((SingleChildCriterion) parent).setChild(replacement);
            case CONDITION -> ((IfCriterion) parent).setCondition(replacement);
            case THEN -> ((IfCriterion) parent).setThenBranch(replacement);
            case ELSE -> ((IfCriterion) parent).setElseBranch(replacement);
        }
    }

    /**
     * Removes a node from a list slot, an else-branch or the document roots.
     *
     * @param document the document owning the forest
     * @param parent   the node's parent, {@code null} for a root
     * @param node     the node to remove
     * @throws TreeInvariantException if the node is not a child of the parent, or occupies a
     *                                required slot
     */
    public static void remove(Document document, Criterion parent, Criterion node) {
        Objects.requireNonNull(document, "document cannot be null");
        Objects.requireNonNull(node, "node cannot be null");

        if (parent == null) {
            List<Criterion> roots = document.roots();
            int index = TreeWalker.indexOf(roots, node);
            if (index < 0) {
                throw notFound(document, null, node);
            }
            roots.remove(index);
            return;
        }

        ChildSlot slot = TreeWalker.slotOf(parent, node);
        if (slot == null) {
            throw notFound(document, parent, node);
        }
        if (slot.isRequired()) {
            throw new TreeInvariantException(String.format(
                    "Cannot remove '%s' from the required %s slot of '%s' in document '%s' without its ancestors; remove it through its NodeVisit",
                    node.typeName(), slot, parent.typeName(), document.id()));
        }
        if (slot == ChildSlot.ELSE) {
            ((IfCriterion) parent).setElseBranch(null);
        } else {
            List<Criterion> children = ((ListCriterion) parent).children();
            children.remove(TreeWalker.indexOf(children, node));
        }
    }

    /**
     * Removes the visited node. When it occupies a required slot, its parent is removed
     * instead, and so on up the path.
     *
     * @param visit a visit recorded on a document
     * @throws TreeInvariantException if a node of the path is no longer where the visit found it
     */
    public static void remove(NodeVisit visit) {
        Document document = requireDocument(visit);
        NodeVisit current = visit;
        while (current.parent() != null) {
            ChildSlot slot = TreeWalker.slotOf(current.parent(), current.node());
            if (slot == null) {
                throw notFound(document, current.parent(), current.node());
            }
            if (!slot.isRequired()) {
                break;
            }
            NodeVisit child = current;
            log.fine(() -> String.format("Removing '%s' leaves '%s' without its %s, removing the parent too",
                    child.node().typeName(), child.parent().typeName(), slot));
            current = current.parentVisit();
        }
        remove(document, current.parent(), current.node());
    }

    /**
     * Replaces the node, or removes it when there is no replacement.
     *
     * @param document    the document owning the forest
     * @param parent      the node's parent, {@code null} for a root
     * @param node        the node to replace
     * @param replacement the new node, or {@code null} to remove
     */
    public static void replaceOrRemove(Document document, Criterion parent, Criterion node, Criterion replacement) {
        if (replacement == null) {
            remove(document, parent, node);
        } else {
            replace(document, parent, node, replacement);
        }
    }

    /**
     * Same as {@link #replaceOrRemove(Document, Criterion, Criterion, Criterion)}, removing
     * through the visit path.
     *
     * @param visit       a visit recorded on a document
     * @param replacement the new node, or {@code null} to remove
     */
    public static void replaceOrRemove(NodeVisit visit, Criterion replacement) {
        if (replacement == null) {
            remove(visit);
        } else {
            replace(requireDocument(visit), visit.parent(), visit.node(), replacement);
        }
    }

    /**
     * Move-to: replaces a leaf with a fresh leaf of another type at the same position.
     *
     * @param document    the document owning the forest
     * @param parent      the leaf's parent, {@code null} for a root
     * @param leaf        the leaf to replace
     * @param newTypeName type of the new leaf
     * @param newFields   fields of the new leaf
     * @return the new leaf
     * @throws TreeInvariantException if the node is not a leaf or is not a child of the parent
     */
    public static LeafCriterion moveTo(Document document, Criterion parent, Criterion leaf,
                                       String newTypeName, Map<String, ?> newFields) {
        if (!leaf.isLeaf()) {
            throw new TreeInvariantException(String.format(
                    "Move-to applies to leaves only, got '%s' in document '%s'", leaf.typeName(), document.id()));
        }
        LeafCriterion moved = new LeafCriterion(newTypeName, newFields);
        replace(document, parent, leaf, moved);
        log.fine(() -> String.format("Moved '%s' to '%s' in document '%s'", leaf.typeName(), newTypeName, document.id()));
        return moved;
    }

    /**
     * @param visit       a visit of a leaf recorded on a document
     * @param newTypeName type of the new leaf
     * @param newFields   fields of the new leaf
     * @return the new leaf
     */
    public static LeafCriterion moveTo(NodeVisit visit, String newTypeName, Map<String, ?> newFields) {
        return moveTo(requireDocument(visit), visit.parent(), visit.node(), newTypeName, newFields);
    }

    private static Document requireDocument(NodeVisit visit) {
        if (visit.document() == null) {
            throw new IllegalArgumentException("The visit was not recorded on a document");
        }
        return visit.document();
    }

    private static TreeInvariantException notFound(Document document, Criterion parent, Criterion node) {
        String owner = parent == null ? "the roots" : "parent '" + parent.typeName() + "'";
        return new TreeInvariantException(String.format(
                "Could not locate node '%s' among the children of %s in document '%s'",
                node.typeName(), owner, document.id()));
    }
}
