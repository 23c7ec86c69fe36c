package io.github.cyfko.curatorkit.core.model;

import java.util.Collection;
import java.util.List;

/**
 * Disjunction of its children. An empty disjunction is legal but vacuous and is removed by pruning.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class OrCriterion extends ListCriterion {

    public OrCriterion(Collection<? extends Criterion> children) {
        super(children);
    }

    public OrCriterion(Criterion... children) {
        super(List.of(children));
    }

    @Override
    public CriterionKind kind() {
        return CriterionKind.OR;
    }

    @Override
    public OrCriterion deepCopy() {
        return new OrCriterion(copyChildren());
    }
}
