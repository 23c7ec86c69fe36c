package io.github.cyfko.curatorkit.core.tree;

import io.github.cyfko.curatorkit.core.model.Criterion;
import io.github.cyfko.curatorkit.core.model.Document;

import java.util.List;
import java.util.Objects;

/**
 * One step of a depth-first walk: the visited node and where it sits.
 *
 * @param document the document owning the forest, or {@code null} when walking bare trees
 * @param node     the visited node
 * @param parent   the parent node, {@code null} for a root
 * @param depth    zero for a root
 * @param path     the ancestors from the root down to the parent, empty for a root
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NodeVisit(Document document, Criterion node, Criterion parent, int depth, List<Criterion> path) {

    public NodeVisit {
        Objects.requireNonNull(node, "node cannot be null");
        path = List.copyOf(path);
        if (depth != path.size()) {
            throw new IllegalArgumentException("depth " + depth + " does not match a path of " + path.size() + " ancestor(s)");
        }
        if (parent != (path.isEmpty() ? null : path.get(path.size() - 1))) {
            throw new IllegalArgumentException("parent must be the last node of the path");
        }
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * @return the parent's own parent, {@code null} if the parent is a root or this is a root
     */
    public Criterion grandparent() {
        return path.size() >= 2 ? path.get(path.size() - 2) : null;
    }

    /**
     * @return the visit of the parent, or {@code null} for a root
     */
    public NodeVisit parentVisit() {
        if (parent == null) {
            return null;
        }
        return new NodeVisit(document, parent, grandparent(), depth - 1, path.subList(0, path.size() - 1));
    }
}
