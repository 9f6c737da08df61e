package io.github.yok.toonlink.model;

import com.google.common.base.Preconditions;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Single scalar cell of a TOON table.
 *
 * <p>
 * A {@code Value} is a tagged union: {@link #getKind()} tells which accessor may be used to read
 * the payload. Calling an accessor of another kind throws {@link IllegalStateException}.
 * </p>
 *
 * <ul>
 * <li>{@link Kind#NULL} - missing value</li>
 * <li>{@link Kind#BOOL} - boolean</li>
 * <li>{@link Kind#INT} - 64-bit signed integer</li>
 * <li>{@link Kind#FLOAT} - IEEE-754 double</li>
 * <li>{@link Kind#STRING} - text</li>
 * </ul>
 *
 * <p>
 * Instances are immutable and compare by kind and payload. Floats are compared with
 * {@link Double#compare(double, double)} semantics, so {@code NaN} equals {@code NaN}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Value {

    /**
     * The kind of payload held by a {@link Value}.
     */
    public enum Kind {
        // Missing value (empty field or a null keyword)
        NULL,
        // true / false
        BOOL,
        // 64-bit signed integer
        INT,
        // IEEE-754 double
        FLOAT,
        // Verbatim text
        STRING
    }

    private static final Value NULL_VALUE = new Value(Kind.NULL, null);
    private static final Value TRUE_VALUE = new Value(Kind.BOOL, Boolean.TRUE);
    private static final Value FALSE_VALUE = new Value(Kind.BOOL, Boolean.FALSE);

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final Kind kind;
    private final Object payload;

    private Value(Kind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    /**
     * Returns the null value.
     *
     * @return shared {@link Kind#NULL} instance
     */
    public static Value ofNull() {
        return NULL_VALUE;
    }

    /**
     * Creates a boolean value.
     *
     * @param value boolean payload
     * @return {@link Kind#BOOL} value
     */
    public static Value ofBool(boolean value) {
        return value ? TRUE_VALUE : FALSE_VALUE;
    }

    /**
     * Creates an integer value.
     *
     * @param value integer payload
     * @return {@link Kind#INT} value
     */
    public static Value ofInt(long value) {
        return new Value(Kind.INT, value);
    }

    /**
     * Creates a floating-point value.
     *
     * @param value double payload, {@code NaN} and infinities included
     * @return {@link Kind#FLOAT} value
     */
    public static Value ofFloat(double value) {
        return new Value(Kind.FLOAT, value);
    }

    /**
     * Creates a string value.
     *
     * @param value text payload
     * @return {@link Kind#STRING} value
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static Value ofString(String value) {
        Preconditions.checkNotNull(value, "string value must not be null; use ofNull()");
        return new Value(Kind.STRING, value);
    }

    /**
     * Converts a plain Java object, as found in a host table cell, into a {@link Value}.
     *
     * <p>
     * Mapping:
     * </p>
     * <ul>
     * <li>{@code null} to {@link Kind#NULL}</li>
     * <li>{@link Boolean} to {@link Kind#BOOL}</li>
     * <li>{@link Byte}, {@link Short}, {@link Integer}, {@link Long}, and a {@link BigInteger}
     * within the {@code long} range to {@link Kind#INT}</li>
     * <li>{@link Float}, {@link Double}, {@link BigDecimal}, and an out-of-range
     * {@link BigInteger} to {@link Kind#FLOAT}</li>
     * <li>a {@link Value} is returned as is</li>
     * <li>anything else to {@link Kind#STRING} via {@code toString()}</li>
     * </ul>
     *
     * @param obj cell object (may be {@code null})
     * @return corresponding value
     */
    public static Value fromObject(Object obj) {
        if (obj == null) {
            return NULL_VALUE;
        }
        if (obj instanceof Value) {
            return (Value) obj;
        }
        if (obj instanceof Boolean) {
            return ofBool((Boolean) obj);
        }
        if (obj instanceof Byte || obj instanceof Short || obj instanceof Integer
                || obj instanceof Long) {
            return ofInt(((Number) obj).longValue());
        }
        if (obj instanceof BigInteger) {
            BigInteger big = (BigInteger) obj;
            if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                return ofInt(big.longValue());
            }
            return ofFloat(big.doubleValue());
        }
        if (obj instanceof Float || obj instanceof Double || obj instanceof BigDecimal) {
            return ofFloat(((Number) obj).doubleValue());
        }
        return ofString(obj.toString());
    }

    /**
     * Returns the kind of this value.
     *
     * @return value kind
     */
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns whether this is the null value.
     *
     * @return {@code true} for {@link Kind#NULL}
     */
    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Returns the boolean payload.
     *
     * @return payload
     * @throws IllegalStateException if this is not a {@link Kind#BOOL}
     */
    public boolean asBool() {
        requireKind(Kind.BOOL);
        return (Boolean) payload;
    }

    /**
     * Returns the integer payload.
     *
     * @return payload
     * @throws IllegalStateException if this is not an {@link Kind#INT}
     */
    public long asInt() {
        requireKind(Kind.INT);
        return (Long) payload;
    }

    /**
     * Returns the floating-point payload.
     *
     * @return payload
     * @throws IllegalStateException if this is not a {@link Kind#FLOAT}
     */
    public double asFloat() {
        requireKind(Kind.FLOAT);
        return (Double) payload;
    }

    /**
     * Returns the string payload.
     *
     * @return payload
     * @throws IllegalStateException if this is not a {@link Kind#STRING}
     */
    public String asString() {
        requireKind(Kind.STRING);
        return (String) payload;
    }

    /**
     * Returns the payload as a plain Java object: {@code null}, {@link Boolean}, {@link Long},
     * {@link Double} or {@link String}.
     *
     * @return boxed payload
     */
    public Object toObject() {
        switch (kind) {
            case NULL:
                return null;
            case BOOL:
            case INT:
            case FLOAT:
            case STRING:
                return payload;
            default:
                throw new IllegalStateException("Unknown value kind: " + kind);
        }
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException(
                    "Value is " + kind + ", not " + expected + ": " + this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        if (kind != other.kind) {
            return false;
        }
        if (kind == Kind.FLOAT) {
            return Double.compare((Double) payload, (Double) other.payload) == 0;
        }
        return Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, payload);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NULL:
                return "Null";
            case BOOL:
                return "Bool(" + payload + ")";
            case INT:
                return "Int(" + payload + ")";
            case FLOAT:
                return "Float(" + payload + ")";
            case STRING:
                return "String(" + payload + ")";
            default:
                throw new IllegalStateException("Unknown value kind: " + kind);
        }
    }
}
