package io.github.cyfko.curatorkit.core.parsing;

import io.github.cyfko.curatorkit.core.config.ParserPolicy;
import io.github.cyfko.curatorkit.core.exception.DSLSyntaxException;

import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Character cursor shared by every recursive-descent parser of CuratorKit.
 * <p>
 * The scanner owns the input text and a position. It offers the primitives the parsers
 * are written with: peeking, consuming single characters or runs of characters, quoted
 * strings with escape decoding, and delimited lists with an optional recovery lookahead.
 * </p>
 *
 * <h2>Missing closing delimiters</h2>
 * <p>
 * {@link #consumeDelimited(char, char, Runnable, Pattern)} accepts a caller-supplied
 * lookahead. After each element, before insisting on {@code ','} or the closing delimiter,
 * the lookahead is matched against the remaining input. A match means the element list was
 * truncated by its producer (typically a language model forgetting a {@code '}'}); the
 * list is then closed implicitly, a warning is logged, and nothing is consumed so the
 * enclosing list can continue with the sibling that follows.
 * </p>
 *
 * <h2>Errors</h2>
 * <p>
 * Every failure raises a {@link DSLSyntaxException} carrying the offset, the one-based
 * line and column, two lines of context and a caret pointer.
 * </p>
 *
 * <p>A scanner is a single-use, single-threaded object: create one per text.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Scanner {

    private static final Logger log = Logger.getLogger(Scanner.class.getName());

    /** Returned by {@link #peek()} at end of input. */
    public static final char EOF = '\0';

    private final String text;
    private final int length;
    private final ParserPolicy policy;
    private int pos;
    private int depth;

    /**
     * Creates a scanner with {@link ParserPolicy#defaults()}.
     *
     * @param text the text to scan
     */
    public Scanner(String text) {
        this(text, ParserPolicy.defaults());
    }

    /**
     * @param text   the text to scan
     * @param policy limits applied while scanning
     * @throws DSLSyntaxException if the text exceeds the policy's maximum length
     */
    public Scanner(String text, ParserPolicy policy) {
        this.text = Objects.requireNonNull(text, "text cannot be null");
        this.policy = Objects.requireNonNull(policy, "Parser policy is required");
        if (text.length() > policy.maxInputLength()) {
            throw new DSLSyntaxException(String.format(
                    "Input too long (%d characters, max: %d). Policy applied: %s",
                    text.length(), policy.maxInputLength(), policy.policyName()));
        }
        this.length = text.length();
        this.pos = 0;
        this.depth = 0;
    }

    public ParserPolicy policy() {
        return policy;
    }

    public String text() {
        return text;
    }

    public int position() {
        return pos;
    }

    /**
     * Moves the cursor back to a previously saved position.
     *
     * @param position a value obtained from {@link #position()}
     */
    public void reset(int position) {
        if (position < 0 || position > length) {
            throw new IllegalArgumentException("Position out of range: " + position);
        }
        this.pos = position;
    }

    public boolean isEof() {
        return pos >= length;
    }

    /**
     * @return the current character, or {@link #EOF}
     */
    public char peek() {
        return pos < length ? text.charAt(pos) : EOF;
    }

    /**
     * @param ahead number of characters past the current one
     * @return the character at that distance, or {@link #EOF}
     */
    public char peek(int ahead) {
        int at = pos + ahead;
        return at < length ? text.charAt(at) : EOF;
    }

    /**
     * @return the consumed character, or {@link #EOF} if the input is exhausted
     */
    public char consume() {
        if (pos >= length) {
            return EOF;
        }
        return text.charAt(pos++);
    }

    /**
     * Consumes the longest run of characters satisfying the predicate.
     *
     * @param predicate character test
     * @return the consumed run, possibly empty
     */
    public String consumeWhile(IntPredicate predicate) {
        int start = pos;
        while (pos < length && predicate.test(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    public void consumeWhitespace() {
        consumeWhile(Character::isWhitespace);
    }

    /**
     * Skips whitespace, then consumes {@code [A-Za-z0-9_]*}.
     *
     * @return the identifier, possibly empty
     */
    public String consumeIdentifier() {
        consumeWhitespace();
        return consumeWhile(c -> c < 128 && (Character.isLetterOrDigit(c) || c == '_'));
    }

    /**
     * @return the input from the cursor to the end, empty at end of input
     */
    public String remaining() {
        return text.substring(pos);
    }

    /**
     * @param prefix expected text
     * @return true if the remaining input starts with the prefix
     */
    public boolean startsWith(String prefix) {
        return text.startsWith(prefix, pos);
    }

    /**
     * Tests a pattern against the remaining input, anchored at the cursor. Nothing is consumed.
     *
     * @param pattern pattern to test
     * @return true if the pattern matches a prefix of the remaining input
     */
    public boolean lookingAt(Pattern pattern) {
        return pattern.matcher(text).region(pos, length).lookingAt();
    }

    /**
     * Skips whitespace and consumes the expected character.
     *
     * @param expected expected character
     * @throws DSLSyntaxException if another character (or end of input) is found
     */
    public void expect(char expected) {
        consumeWhitespace();
        if (peek() != expected) {
            throw fail(String.format("Expected '%c', got %s", expected, describeCurrent()));
        }
        pos++;
    }

    /**
     * Consumes a quoted string and decodes its escape sequences.
     * <p>
     * Supported escapes: {@code \n \t \r \b \f \" \' \\ \/} and {@code \}{@code uXXXX}.
     * Any other escaped character is kept as is.
     * </p>
     *
     * @param quote the opening and closing quote character
     * @return the decoded content
     * @throws DSLSyntaxException if no opening quote is found or the string is never closed
     */
    public String consumeQuotedString(char quote) {
        consumeWhitespace();
        if (peek() != quote) {
            throw fail(String.format("Expected opening quote %c for string, got %s", quote, describeCurrent()));
        }
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < length) {
            char c = text.charAt(pos);
            if (c == quote) {
                pos++;
                return sb.toString();
            }
            if (c == '\\') {
                if (pos + 1 >= length) {
                    break;
                }
                char escaped = text.charAt(pos + 1);
                pos += 2;
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'u' -> sb.append(decodeUnicodeEscape());
                    default -> sb.append(escaped);
                }
                continue;
            }
            sb.append(c);
            pos++;
        }
        throw failAt("Unterminated string, missing closing quote " + quote, start);
    }

    /**
     * Consumes a delimited, comma separated list of elements.
     * <p>
     * The opening delimiter is consumed first, then the element consumer is invoked once per
     * element until the closing delimiter is consumed. An empty list is accepted. When the
     * policy allows it, a comma directly before the closing delimiter is accepted too.
     * </p>
     *
     * @param open              opening delimiter
     * @param close             closing delimiter
     * @param elementConsumer   consumes exactly one element at the cursor
     * @param missingCloseLookahead pattern matched against the input after an element; a match
     *                          closes the list implicitly. May be {@code null}
     * @return {@code true} if the closing delimiter was consumed, {@code false} if the lookahead
     *         closed the list implicitly
     * @throws DSLSyntaxException if the delimiters or separators are wrong
     */
    public boolean consumeDelimited(char open, char close, Runnable elementConsumer, Pattern missingCloseLookahead) {
        consumeWhitespace();
        if (peek() != open) {
            throw fail(String.format("Expected '%c', got %s", open, describeCurrent()));
        }
        pos++;
        descend();
        try {
            consumeWhitespace();
            if (peek() == close) {
                pos++;
                return true;
            }

            while (true) {
                consumeWhitespace();
                elementConsumer.run();
                consumeWhitespace();

                if (missingCloseLookahead != null && lookingAt(missingCloseLookahead)) {
                    int at = pos;
                    log.warning(() -> String.format(
                            "Expected ',' or '%c' at offset %d, found the start of an enclosing sibling; assuming a '%c' is missing",
                            close, at, close));
                    return false;
                }

                char next = peek();
                if (next == close) {
                    pos++;
                    return true;
                }
                if (next != ',') {
                    throw fail(String.format("Expected ',' or '%c', got %s", close, describeCurrent()));
                }
                pos++;
                if (policy.allowTrailingComma()) {
                    consumeWhitespace();
                    if (peek() == close) {
                        pos++;
                        return true;
                    }
                }
            }
        } finally {
            ascend();
        }
    }

    /**
     * Enters one nesting level.
     *
     * @throws DSLSyntaxException if the policy's maximum depth is exceeded
     */
    public void descend() {
        if (++depth > policy.maxDepth()) {
            throw fail(String.format("Nesting too deep (max: %d). Policy applied: %s",
                    policy.maxDepth(), policy.policyName()));
        }
    }

    public void ascend() {
        depth--;
    }

    /**
     * Describes the character at the cursor for error messages.
     *
     * @return {@code 'x'} or {@code end of input}
     */
    public String describeCurrent() {
        return isEof() ? "end of input" : "'" + peek() + "'";
    }

    /**
     * Builds a located syntax error at the cursor. Callers throw the result.
     *
     * @param reason what went wrong
     * @return the exception to throw
     */
    public DSLSyntaxException fail(String reason) {
        return failAt(reason, pos);
    }

    /**
     * Builds a located syntax error at the given offset. Callers throw the result.
     *
     * @param reason what went wrong
     * @param offset zero-based offset of the offending character
     * @return the exception to throw
     */
    public DSLSyntaxException failAt(String reason, int offset) {
        int at = Math.max(0, Math.min(offset, length));
        int lineStart = text.lastIndexOf('\n', at - 1) + 1;
        int lineEnd = text.indexOf('\n', at);
        if (lineEnd < 0) {
            lineEnd = length;
        }
        int line = 1;
        for (int i = 0; i < lineStart; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        int column = at - lineStart + 1;

        String current = text.substring(lineStart, lineEnd);
        String snippet = current;
        if (lineStart > 0) {
            int previousStart = text.lastIndexOf('\n', lineStart - 2) + 1;
            snippet = text.substring(previousStart, lineStart - 1) + "\n" + current;
        }
        String pointer = " ".repeat(column - 1) + "^";
        return new DSLSyntaxException(reason, at, line, column, snippet, pointer);
    }

    private char decodeUnicodeEscape() {
        if (pos + 4 > length) {
            throw failAt("Truncated unicode escape", pos - 2);
        }
        String hex = text.substring(pos, pos + 4);
        try {
            char decoded = (char) Integer.parseInt(hex, 16);
            pos += 4;
            return decoded;
        } catch (NumberFormatException e) {
            throw failAt("Invalid unicode escape \\u" + hex, pos - 2);
        }
    }
}
