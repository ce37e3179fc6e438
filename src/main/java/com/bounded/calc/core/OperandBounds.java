package com.bounded.calc.core;

/**
 * Inclusive range every operand must fall into.
 *
 * <p>
 * Only inputs are checked against the bounds. Results are free to leave the
 * range, e.g. {@code MAX * 2}.
 *
 * @param min lowest accepted operand (inclusive)
 * @param max highest accepted operand (inclusive)
 */
public record OperandBounds(long min, long max) {

    /** The standard range {@code [-1_000_000, 1_000_000]}. */
    public static final OperandBounds STANDARD = new OperandBounds(-1_000_000L, 1_000_000L);

    public OperandBounds {
        if (min > max) {
            throw new IllegalArgumentException("Invalid bounds: min " + min + " is greater than max " + max);
        }
    }

    public boolean contains(long value) {
        return value >= min && value <= max;
    }

    /**
     * NaN compares false against both ends, so it is never contained.
     */
    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
