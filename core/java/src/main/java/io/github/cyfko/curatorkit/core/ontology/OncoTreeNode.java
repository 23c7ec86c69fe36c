package io.github.cyfko.curatorkit.core.ontology;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the {@link OncoTree}: a tumour type identified by its code.
 * <p>
 * Nodes are created and linked by {@link OncoTree#fromTable} only; once the tree is built
 * they never change.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OncoTreeNode {

    private final String code;
    private final String name;
    private final int level;
    private OncoTreeNode parent;
    private final Map<String, OncoTreeNode> children = new LinkedHashMap<>();

    OncoTreeNode(String code, String name, int level) {
        this.code = code;
        this.name = name;
        this.level = level;
    }

    public String code() {
        return code;
    }

    public String name() {
        return name;
    }

    /**
     * @return the depth of the node, from 1 (tissue) to {@value OncoTree#MAX_LEVEL}
     */
    public int level() {
        return level;
    }

    /**
     * @return the parent, or {@code null} for a root
     */
    public OncoTreeNode parent() {
        return parent;
    }

    /**
     * @return the children, in the order they were first seen
     */
    public Collection<OncoTreeNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    /**
     * @return the canonical term, {@code "Name (CODE)"}
     */
    public String term() {
        return name + " (" + code + ")";
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    void attachTo(OncoTreeNode newParent) {
        this.parent = newParent;
        newParent.children.put(code, this);
    }

    @Override
    public String toString() {
        return term() + "@" + level;
    }
}
