package io.github.cyfko.curatorkit.core.exception;

import io.github.cyfko.curatorkit.core.impl.CriterionDslParser;
import io.github.cyfko.curatorkit.core.impl.RuleDslParser;
import io.github.cyfko.curatorkit.core.json.SmartJsonParser;
import io.github.cyfko.curatorkit.core.parsing.Scanner;

/**
 * Exception thrown when a text does not match the grammar expected at the current position.
 * <p>
 * Raised by the {@link Scanner} and by every parser built on it. A syntax error is always
 * fatal for the document being parsed: recoverable malformations (missing closing
 * delimiters, collapsed JSON keys, ...) are logged as warnings and never reach this type.
 * </p>
 *
 * <p>When the error has a location, the exception carries it in full:</p>
 * <ul>
 *   <li><strong>offset</strong>: zero-based character offset in the input</li>
 *   <li><strong>line</strong>: one-based line number</li>
 *   <li><strong>column</strong>: one-based column number</li>
 *   <li><strong>snippet</strong>: the offending line preceded by the line before it</li>
 *   <li><strong>pointer</strong>: a caret aligned under the offending column</li>
 * </ul>
 *
 * <p><strong>Error Example:</strong></p>
 * <pre>{@code
 * parser.parse("not{age(min=18), sex(value=\"male\")}");
 * // → Expected 1 child in 'not', got 2 (line 1, column 1):
 * //   not{age(min=18), sex(value="male")}
 * //   ^
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see CriterionDslParser
 * @see RuleDslParser
 * @see SmartJsonParser
 */
public class DSLSyntaxException extends CuratorException {

    private final int offset;
    private final int line;
    private final int column;
    private final String snippet;
    private final String pointer;

    /**
     * Constructor for errors without a location (empty input, size limits).
     *
     * @param message the message describing the cause of the exception
     */
    public DSLSyntaxException(String message) {
        super(message);
        this.offset = -1;
        this.line = -1;
        this.column = -1;
        this.snippet = "";
        this.pointer = "";
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public DSLSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.offset = -1;
        this.line = -1;
        this.column = -1;
        this.snippet = "";
        this.pointer = "";
    }

    /**
     * Constructor for located errors.
     *
     * @param reason  the bare reason, without location
     * @param offset  zero-based character offset
     * @param line    one-based line number
     * @param column  one-based column number
     * @param snippet context lines around the offset
     * @param pointer caret line aligned to the column
     */
    public DSLSyntaxException(String reason, int offset, int line, int column, String snippet, String pointer) {
        super(String.format("%s (line %d, column %d):%n%s%n%s", reason, line, column, snippet, pointer));
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.snippet = snippet;
        this.pointer = pointer;
    }

    /** @return zero-based offset of the error, or -1 when the error has no location */
    public int offset() {
        return offset;
    }

    /** @return one-based line of the error, or -1 when the error has no location */
    public int line() {
        return line;
    }

    /** @return one-based column of the error, or -1 when the error has no location */
    public int column() {
        return column;
    }

    /** @return the context lines around the error, empty when the error has no location */
    public String snippet() {
        return snippet;
    }

    /** @return the caret line pointing at the error column, empty when the error has no location */
    public String pointer() {
        return pointer;
    }

    /** @return true if offset, line and column are available */
    public boolean hasLocation() {
        return offset >= 0;
    }
}
