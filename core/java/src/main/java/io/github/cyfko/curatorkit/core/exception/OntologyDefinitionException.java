package io.github.cyfko.curatorkit.core.exception;

/**
 * Exception thrown when an ontology source table contradicts itself.
 * <p>
 * Typical causes: a code listed at two different levels, a code listed under two
 * different parents or two different names, or required level columns missing.
 * Construction stops at the first contradiction; nothing is silently merged.
 * </p>
 *
 * <pre>{@code
 * throw new OntologyDefinitionException("Code LUAD appears at multiple levels: 2 vs 3");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OntologyDefinitionException extends CuratorException {

    public OntologyDefinitionException(String message) {
        super(message);
    }

    public OntologyDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
