package io.github.cyfko.curatorkit.core.exception;

/**
 * Exception thrown when a criterion tree breaks a structural contract.
 * <p>
 * Unlike {@link DSLSyntaxException}, this never signals malformed free text: it means an
 * upstream producer or a caller handed the tree engine something impossible, such as a
 * parent that does not hold the node it is said to hold, or a {@code NOT} without exactly
 * one child. It must never be swallowed.
 * </p>
 *
 * <p><strong>Usage Examples:</strong></p>
 * <pre>{@code
 * throw new TreeInvariantException("Could not locate node 'histology' under parent 'and'");
 * throw new TreeInvariantException("'not' requires exactly one child");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TreeInvariantException extends CuratorException {

    /**
     * @param message explanation naming the node and parent involved
     */
    public TreeInvariantException(String message) {
        super(message);
    }

    /**
     * @param message explanation naming the node and parent involved
     * @param cause   underlying exception
     */
    public TreeInvariantException(String message, Throwable cause) {
        super(message, cause);
    }
}
