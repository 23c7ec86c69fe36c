package io.github.cyfko.curatorkit.core.model;

import java.util.Collection;
import java.util.List;

/**
 * Conjunction of its children. An empty conjunction is legal but vacuous and is removed by pruning.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AndCriterion extends ListCriterion {

    public AndCriterion(Collection<? extends Criterion> children) {
        super(children);
    }

    public AndCriterion(Criterion... children) {
        super(List.of(children));
    }

    @Override
    public CriterionKind kind() {
        return CriterionKind.AND;
    }

    @Override
    public AndCriterion deepCopy() {
        return new AndCriterion(copyChildren());
    }
}
