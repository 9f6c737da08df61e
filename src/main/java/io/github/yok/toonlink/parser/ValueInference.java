package io.github.yok.toonlink.parser;

import io.github.yok.toonlink.model.Value;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Infers a typed {@link Value} from an untyped TOON field.
 *
 * <p>
 * Rules are tried in order, the first match wins:
 * </p>
 * <ol>
 * <li>empty, {@code null}, {@code none}, {@code na}, {@code nan} (any case) to null</li>
 * <li>{@code true} / {@code false} (any case) to a boolean</li>
 * <li>a token without {@code .}, {@code e} or {@code E} that parses as a signed 64-bit integer to
 * an integer</li>
 * <li>a decimal floating-point literal, or {@code inf} / {@code infinity} with an optional sign, to
 * a float</li>
 * <li>anything else to a string, verbatim</li>
 * </ol>
 *
 * <p>
 * Inference is total: it never throws. Integers outside the {@code long} range fall through to the
 * float rule.
 * </p>
 *
 * <p>
 * {@code inf}, {@code -inf} and {@code infinity} are deliberately read as floats rather than
 * strings; they are the only tokens treated this way. See the "Infinity" entry in DESIGN.md.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueInference {

    // Decimal literal: no hex floats, no d/f suffixes
    private static final Pattern DECIMAL_FLOAT =
            Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private static final Pattern INFINITY =
            Pattern.compile("([+-]?)(?:inf|infinity)", Pattern.CASE_INSENSITIVE);

    private ValueInference() {
        // Utility class; do not instantiate.
    }

    /**
     * Infers the value of a single field.
     *
     * @param token raw field text (may be {@code null}, read as empty)
     * @return inferred value, never {@code null}
     */
    public static Value infer(String token) {
        String val = StringUtils.strip(StringUtils.defaultString(token));
        String lower = val.toLowerCase(Locale.ROOT);

        if (val.isEmpty() || ToonSyntax.NULL_KEYWORDS.contains(lower)) {
            return Value.ofNull();
        }
        if (ToonSyntax.TRUE_KEYWORD.equals(lower)) {
            return Value.ofBool(true);
        }
        if (ToonSyntax.FALSE_KEYWORD.equals(lower)) {
            return Value.ofBool(false);
        }

        if (val.indexOf('.') < 0 && lower.indexOf('e') < 0) {
            try {
                return Value.ofInt(Long.parseLong(val));
            } catch (NumberFormatException ex) {
                // not an in-range integer; try as float
            }
        }

        Double floating = parseFloat(val);
        if (floating != null) {
            return Value.ofFloat(floating);
        }
        return Value.ofString(val);
    }

    private static Double parseFloat(String val) {
        if (DECIMAL_FLOAT.matcher(val).matches()) {
            try {
                return Double.parseDouble(val);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        Matcher inf = INFINITY.matcher(val);
        if (inf.matches()) {
            return "-".equals(inf.group(1)) ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return null;
    }
}
