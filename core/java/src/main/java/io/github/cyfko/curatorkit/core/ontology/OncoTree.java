package io.github.cyfko.curatorkit.core.ontology;

import io.github.cyfko.curatorkit.core.config.PatternConfig;
import io.github.cyfko.curatorkit.core.exception.OntologyDefinitionException;
import io.github.cyfko.curatorkit.core.lookup.ResourceTable;
import io.github.cyfko.curatorkit.core.lookup.TextNormalizer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/**
 * Hierarchical index of tumour types, built from a path table.
 *
 * <h2>Source format</h2>
 * <p>
 * The source has columns {@code level_1} to {@code level_7}; each row is a path from a tissue
 * down to a subtype and each non-empty cell reads {@code "Name (CODE)"}. Cells without a
 * trailing code are ignored. Other columns are ignored.
 * </p>
 *
 * <h2>Invariants</h2>
 * <p>
 * Across the whole source a code has a single level, a single name and a single parent.
 * Any contradiction stops construction with an {@link OntologyDefinitionException}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * OncoTree tree = OncoTree.fromTable(resource);
 * tree.lift("LUAD", 1).map(OncoTreeNode::term);          // Optional[Lung (LUNG)]
 * tree.levelsForTerms(List.of("Lung (LUNG)", "Non-Small Cell Lung Cancer (NSCLC)"));
 * }</pre>
 *
 * <p>Instances are immutable once built and safe to share between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OncoTree {

    private static final Logger log = Logger.getLogger(OncoTree.class.getName());

    public static final int MAX_LEVEL = 7;
    public static final String LEVEL_COLUMN_PREFIX = "level_";

    private final Map<String, OncoTreeNode> nodesByCode;
    private final Map<String, OncoTreeNode> roots;
    private final Map<String, OncoTreeNode> nodesByTerm;

    private OncoTree(Map<String, OncoTreeNode> nodesByCode, Map<String, OncoTreeNode> roots) {
        this.nodesByCode = Collections.unmodifiableMap(nodesByCode);
        this.roots = Collections.unmodifiableMap(roots);
        Map<String, OncoTreeNode> byTerm = new LinkedHashMap<>();
        for (OncoTreeNode node : nodesByCode.values()) {
            byTerm.put(TextNormalizer.normalize(node.term()), node);
        }
        this.nodesByTerm = Collections.unmodifiableMap(byTerm);
    }

    /**
     * Parsed {@code "Name (CODE)"} cell.
     *
     * @param name the name, never blank
     * @param code the code, never blank
     */
    public record NameCode(String name, String code) {
    }

    /**
     * Parses a {@code "Name (CODE)"} cell. The code must be the trailing token.
     *
     * @param cell the cell
     * @return the name and code, or empty for a blank cell, a missing code or a missing name
     */
    public static Optional<NameCode> parseNameCode(Object cell) {
        if (TextNormalizer.isEffectivelyEmpty(cell)) {
            return Optional.empty();
        }
        String text = TextNormalizer.fixMojibake(String.valueOf(cell)).strip();
        Matcher matcher = PatternConfig.NAME_CODE_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String code = matcher.group(1).strip();
        String name = text.substring(0, matcher.start()).strip();
        if (code.isEmpty() || name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new NameCode(name, code));
    }

    /**
     * Builds the tree from a loaded path table.
     *
     * @param table a table with the columns {@code level_1} to {@code level_7}
     * @return the tree
     * @throws OntologyDefinitionException if a level column is missing or the rows contradict each other
     */
    public static OncoTree fromTable(ResourceTable table) {
        Objects.requireNonNull(table, "table cannot be null");
        List<String> missing = new ArrayList<>();
        for (int level = 1; level <= MAX_LEVEL; level++) {
            if (!table.hasColumn(LEVEL_COLUMN_PREFIX + level)) {
                missing.add(LEVEL_COLUMN_PREFIX + level);
            }
        }
        if (!missing.isEmpty()) {
            throw new OntologyDefinitionException(String.format(
                    "Ontology source '%s' is missing expected columns: %s", table.name(), missing));
        }

        Map<String, OncoTreeNode> nodesByCode = new LinkedHashMap<>();
        Map<String, OncoTreeNode> roots = new LinkedHashMap<>();

        for (ResourceTable.Row row : table.rows()) {
            OncoTreeNode previous = null;
            for (int level = 1; level <= MAX_LEVEL; level++) {
                Optional<NameCode> parsed = parseNameCode(row.get(LEVEL_COLUMN_PREFIX + level));
                if (parsed.isEmpty()) {
                    continue;
                }
                NameCode nameCode = parsed.get();
                OncoTreeNode node = nodesByCode.get(nameCode.code());
                if (node == null) {
                    node = new OncoTreeNode(nameCode.code(), nameCode.name(), level);
                    nodesByCode.put(node.code(), node);
                } else {
                    if (node.level() != level) {
                        throw new OntologyDefinitionException(String.format(
                                "Code %s appears at multiple levels: %d vs %d (row %d)",
                                node.code(), node.level(), level, row.index()));
                    }
                    if (!node.name().equals(nameCode.name())) {
                        throw new OntologyDefinitionException(String.format(
                                "Code %s has inconsistent names: '%s' vs '%s' (row %d)",
                                node.code(), node.name(), nameCode.name(), row.index()));
                    }
                }

                if (previous == null) {
                    if (node.isRoot()) {
                        roots.putIfAbsent(node.code(), node);
                    }
                } else if (node.parent() == null) {
                    node.attachTo(previous);
                    roots.remove(node.code());
                } else if (!node.parent().code().equals(previous.code())) {
                    throw new OntologyDefinitionException(String.format(
                            "Inconsistent parent for %s: %s vs %s (row %d)",
                            node.code(), node.parent().code(), previous.code(), row.index()));
                }
                previous = node;
            }
        }

        OncoTree tree = new OncoTree(nodesByCode, roots);
        log.fine(() -> String.format("Built ontology from '%s': %d node(s), %d root(s)",
                table.name(), tree.size(), tree.roots.size()));
        return tree;
    }

    /**
     * @param code a code, matched exactly
     * @return the node
     */
    public Optional<OncoTreeNode> get(String code) {
        return Optional.ofNullable(nodesByCode.get(code));
    }

    /**
     * Finds a node by its {@code "Name (CODE)"} term, normalized, or by its code.
     *
     * @param termOrCode a term or a code
     * @return the node
     */
    public Optional<OncoTreeNode> find(String termOrCode) {
        if (termOrCode == null) {
            return Optional.empty();
        }
        OncoTreeNode node = nodesByTerm.get(TextNormalizer.normalize(termOrCode));
        if (node == null) {
            node = nodesByCode.get(termOrCode.strip());
        }
        return Optional.ofNullable(node);
    }

    /**
     * @param termOrCode a {@code "Name (CODE)"} term or a code
     * @return the level of the node
     */
    public Optional<Integer> levelOf(String termOrCode) {
        return find(termOrCode).map(OncoTreeNode::level);
    }

    /**
     * Converts terms into the parallel list of their levels.
     *
     * @param terms {@code "Name (CODE)"} terms
     * @return the levels, or empty if any term is unknown
     */
    public Optional<List<Integer>> levelsForTerms(List<String> terms) {
        List<Integer> levels = new ArrayList<>(terms.size());
        for (String term : terms) {
            Optional<Integer> level = levelOf(term);
            if (level.isEmpty()) {
                log.fine(() -> String.format("Unknown ontology term '%s'", term));
                return Optional.empty();
            }
            levels.add(level.get());
        }
        return Optional.of(levels);
    }

    /**
     * Returns the ancestor of a node at the given level, the node itself included.
     *
     * @param code        a code
     * @param targetLevel the wanted level
     * @return the ancestor, or empty if the code is unknown or the path has no node at that level
     */
    public Optional<OncoTreeNode> lift(String code, int targetLevel) {
        OncoTreeNode current = nodesByCode.get(code);
        while (current != null && current.level() > targetLevel) {
            current = current.parent();
        }
        if (current == null || current.level() != targetLevel) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    /**
     * @param code a code
     * @return the path from the root down to the node, both included; empty for an unknown code
     */
    public List<OncoTreeNode> ancestors(String code) {
        List<OncoTreeNode> path = new ArrayList<>();
        for (OncoTreeNode current = nodesByCode.get(code); current != null; current = current.parent()) {
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * @param code a code
     * @return the nodes of {@link #ancestors(String)} keyed by level
     */
    public Map<Integer, OncoTreeNode> ancestorsByLevel(String code) {
        Map<Integer, OncoTreeNode> byLevel = new LinkedHashMap<>();
        for (OncoTreeNode node : ancestors(code)) {
            byLevel.put(node.level(), node);
        }
        return byLevel;
    }

    /**
     * @param code a code
     * @return every node below this one, depth-first in child order, the node excluded
     */
    public List<OncoTreeNode> descendants(String code) {
        OncoTreeNode node = nodesByCode.get(code);
        if (node == null) {
            return List.of();
        }
        List<OncoTreeNode> result = new ArrayList<>();
        Deque<OncoTreeNode> stack = new ArrayDeque<>();
        pushChildren(stack, node);
        while (!stack.isEmpty()) {
            OncoTreeNode current = stack.pop();
            result.add(current);
            pushChildren(stack, current);
        }
        return result;
    }

    /**
     * @param code a code
     * @return the descendants without children, the node excluded
     */
    public List<OncoTreeNode> leafDescendants(String code) {
        List<OncoTreeNode> leaves = new ArrayList<>();
        for (OncoTreeNode node : descendants(code)) {
            if (node.isLeaf()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    /**
     * @return the nodes without parent, in the order they were first seen
     */
    public Collection<OncoTreeNode> roots() {
        return roots.values();
    }

    public int size() {
        return nodesByCode.size();
    }

    // children are pushed in reverse so they pop in their own order
    private static void pushChildren(Deque<OncoTreeNode> stack, OncoTreeNode node) {
        List<OncoTreeNode> children = new ArrayList<>(node.children());
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    @Override
    public String toString() {
        return "OncoTree[nodes=" + nodesByCode.size() + ", roots=" + roots.keySet() + "]";
    }
}
