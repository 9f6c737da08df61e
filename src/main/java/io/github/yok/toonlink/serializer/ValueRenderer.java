package io.github.yok.toonlink.serializer;

import io.github.yok.toonlink.model.Value;
import io.github.yok.toonlink.parser.ToonSyntax;

/**
 * Renders a {@link Value} as a TOON field, the inverse of
 * {@link io.github.yok.toonlink.parser.ValueInference}.
 *
 * <ul>
 * <li>null and a {@code NaN} float: empty field</li>
 * <li>boolean: {@code true} / {@code false}</li>
 * <li>integer: {@link Long#toString(long)}</li>
 * <li>float: {@link Double#toString(double)}, e.g. {@code 95000.0}, {@code 1.0E20},
 * {@code Infinity}</li>
 * <li>string: verbatim, without quoting or escaping</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueRenderer {

    private ValueRenderer() {
        // Utility class; do not instantiate.
    }

    /**
     * Renders a single value.
     *
     * @param value value to render
     * @return field text
     */
    public static String render(Value value) {
        switch (value.getKind()) {
            case NULL:
                return "";
            case BOOL:
                return value.asBool() ? ToonSyntax.TRUE_KEYWORD : ToonSyntax.FALSE_KEYWORD;
            case INT:
                return Long.toString(value.asInt());
            case FLOAT:
                double d = value.asFloat();
                return Double.isNaN(d) ? "" : Double.toString(d);
            case STRING:
                return value.asString();
            default:
                throw new IllegalStateException("Unknown value kind: " + value.getKind());
        }
    }
}
