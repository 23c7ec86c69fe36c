package io.github.cyfko.curatorkit.core.exception;

/**
 * Base class of every error raised by CuratorKit.
 * <p>
 * Callers processing many documents at once can catch this single type to skip a
 * failed document, and inspect the concrete subclass to tell bad input
 * ({@link DSLSyntaxException}) apart from a broken internal contract
 * ({@link TreeInvariantException}, {@link OntologyDefinitionException}).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class CuratorException extends RuntimeException {

    protected CuratorException(String message) {
        super(message);
    }

    protected CuratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
