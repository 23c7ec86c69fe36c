package io.github.cyfko.curatorkit.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One curated source unit: the rule text it was derived from and the forest of criterion
 * roots parsed out of it.
 * <p>
 * The forest is mutable; rewriting may remove or replace roots. A document whose forest
 * became empty carries no criterion anymore and can be discarded by the caller.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Document {

    private final String id;
    private final String ruleText;
    private final List<Criterion> roots;

    /**
     * @param id       identifier used in logs and batch reports
     * @param ruleText the source text the criteria were curated from, may be empty
     * @param roots    initial forest roots
     */
    public Document(String id, String ruleText, Collection<? extends Criterion> roots) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Document id is required");
        }
        this.id = id;
        this.ruleText = ruleText == null ? "" : ruleText;
        this.roots = new ArrayList<>(Objects.requireNonNull(roots, "roots cannot be null"));
    }

    public Document(String id, Criterion root) {
        this(id, "", List.of(root));
    }

    public String id() {
        return id;
    }

    public String ruleText() {
        return ruleText;
    }

    /**
     * @return the live, mutable forest
     */
    public List<Criterion> roots() {
        return roots;
    }

    /**
     * @return true when no root is left
     */
    public boolean isDiscardable() {
        return roots.isEmpty();
    }

    @Override
    public String toString() {
        return "Document[id=" + id + ", roots=" + roots + "]";
    }
}
