package io.github.yok.toonlink.parser;

/**
 * How the parser treats a data row whose field count differs from the header's column count.
 *
 * <ul>
 * <li>LENIENT: keep the row exactly as split (default)</li>
 * <li>STRICT: fail with {@link ToonParseException.Reason#ROW_ARITY_MISMATCH}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ArityPolicy {
    // Ragged rows are passed through as parsed
    LENIENT,
    // Ragged rows abort the parse
    STRICT
}
