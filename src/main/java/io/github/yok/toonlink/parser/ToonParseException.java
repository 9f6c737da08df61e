package io.github.yok.toonlink.parser;

import lombok.Getter;

/**
 * Thrown when TOON text cannot be turned into a document.
 *
 * <p>
 * A parse either succeeds completely or fails with one of the {@link Reason}s; no partial
 * document is returned. Malformed individual fields never cause this exception, since they degrade
 * to strings or nulls.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ToonParseException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Failure categories.
     */
    public enum Reason {
        // The input has no non-blank line
        EMPTY_CONTENT,
        // Only a table-name line was found
        MISSING_HEADER,
        // A data row has a field count other than the column count (strict mode only)
        ROW_ARITY_MISMATCH
    }

    private final Reason reason;

    // 1-based line number of the offending line, or 0 when not tied to a line
    private final int lineNumber;

    /**
     * Creates an exception that is not tied to a specific line.
     *
     * @param reason failure category
     * @param message detail message
     */
    public ToonParseException(Reason reason, String message) {
        this(reason, message, 0);
    }

    /**
     * Creates an exception for a specific line.
     *
     * @param reason failure category
     * @param message detail message
     * @param lineNumber 1-based line number
     */
    public ToonParseException(Reason reason, String message, int lineNumber) {
        super(message);
        this.reason = reason;
        this.lineNumber = lineNumber;
    }
}
