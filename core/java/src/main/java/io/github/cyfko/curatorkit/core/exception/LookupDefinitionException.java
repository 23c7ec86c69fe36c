package io.github.cyfko.curatorkit.core.exception;

/**
 * Raised when a resource table cannot back a lookup: missing key column, empty key list.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class LookupDefinitionException extends CuratorException {

    public LookupDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates a new LookupDefinitionException with detailed message and cause.
     *
     * @param message explanation of the failure
     * @param cause underlying exception causing this failure
     */
    public LookupDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
