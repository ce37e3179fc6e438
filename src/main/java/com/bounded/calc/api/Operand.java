package com.bounded.calc.api;

import com.bounded.calc.core.InvalidInputException;

import java.math.BigInteger;

/**
 * A numeric operand: either an exact signed integer or a double.
 *
 * <p>
 * The set of kinds is closed. Dynamically typed values enter through
 * {@link #of(Object)}, which maps boxed integers, {@link BigInteger},
 * floats and doubles onto the two kinds and rejects everything else.
 * Booleans are accepted as {@code 1} and {@code 0}.
 *
 * <p>
 * Instances are immutable and compare by kind and value.
 */
public final class Operand {

    /** Message used whenever a value is not of a numeric kind. */
    public static final String NOT_NUMERIC = "Inputs must be int or float";

    public enum Kind {
        INTEGER,
        FLOATING
    }

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final Kind kind;
    private final long longValue;
    private final double doubleValue;

    private Operand(Kind kind, long longValue, double doubleValue) {
        this.kind = kind;
        this.longValue = longValue;
        this.doubleValue = doubleValue;
    }

    public static Operand ofLong(long value) {
        return new Operand(Kind.INTEGER, value, value);
    }

    public static Operand ofDouble(double value) {
        return new Operand(Kind.FLOATING, (long) value, value);
    }

    /**
     * Converts a dynamically typed value.
     *
     * @throws InvalidInputException if the value is not of a numeric kind
     */
    public static Operand of(Object value) {
        if (value instanceof Operand operand) {
            return operand;
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return ofLong(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return ofDouble(((Number) value).doubleValue());
        }
        if (value instanceof BigInteger big) {
            // Too wide for a long means far outside any bounds; keep it comparable.
            if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                return ofLong(big.longValue());
            }
            return ofDouble(big.doubleValue());
        }
        if (value instanceof Boolean flag) {
            return ofLong(flag ? 1L : 0L);
        }
        throw new InvalidInputException(NOT_NUMERIC);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isInteger() {
        return kind == Kind.INTEGER;
    }

    /**
     * Integer value. For a {@link Kind#FLOATING} operand this truncates.
     */
    public long longValue() {
        return longValue;
    }

    public double doubleValue() {
        return doubleValue;
    }

    /** True for {@code 0}, {@code 0.0} and {@code -0.0}. */
    public boolean isZero() {
        return kind == Kind.INTEGER ? longValue == 0L : doubleValue == 0.0;
    }

    /**
     * Boxes the value in its natural Java type, {@link Long} or {@link Double}.
     */
    public Number toNumber() {
        return kind == Kind.INTEGER ? (Number) longValue : (Number) doubleValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operand)) {
            return false;
        }
        Operand other = (Operand) o;
        if (kind != other.kind) {
            return false;
        }
        return kind == Kind.INTEGER
                ? longValue == other.longValue
                : Double.compare(doubleValue, other.doubleValue) == 0;
    }

    @Override
    public int hashCode() {
        return kind == Kind.INTEGER
                ? Long.hashCode(longValue)
                : 31 * Double.hashCode(doubleValue) + 1;
    }

    @Override
    public String toString() {
        return kind == Kind.INTEGER ? Long.toString(longValue) : Double.toString(doubleValue);
    }
}
