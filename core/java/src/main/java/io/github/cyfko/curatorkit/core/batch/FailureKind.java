package io.github.cyfko.curatorkit.core.batch;

import io.github.cyfko.curatorkit.core.exception.CuratorException;
import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;
import io.github.cyfko.curatorkit.core.exception.JsonRecoveryException;
import io.github.cyfko.curatorkit.core.exception.LookupDefinitionException;
import io.github.cyfko.curatorkit.core.exception.OntologyDefinitionException;
import io.github.cyfko.curatorkit.core.exception.TreeInvariantException;

/**
 * Category of a per-document failure in a batch run.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum FailureKind {
    SYNTAX,
    TREE_INVARIANT,
    JSON_RECOVERY,
    ONTOLOGY,
    LOOKUP,
    OTHER;

    public static FailureKind of(CuratorException error) {
        if (error instanceof DSLSyntaxException) {
            return SYNTAX;
        }
        if (error instanceof TreeInvariantException) {
            return TREE_INVARIANT;
        }
        if (error instanceof JsonRecoveryException) {
            return JSON_RECOVERY;
        }
        if (error instanceof OntologyDefinitionException) {
            return ONTOLOGY;
        }
        if (error instanceof LookupDefinitionException) {
            return LOOKUP;
        }
        return OTHER;
    }
}
