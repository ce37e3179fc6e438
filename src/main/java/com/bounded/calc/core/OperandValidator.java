package com.bounded.calc.core;

import com.bounded.calc.api.Operand;

/**
 * Checks operands against an {@link OperandBounds} range.
 *
 * <p>
 * Every operand is checked in argument order and the first failure is thrown.
 * The validator holds no mutable state and may be shared across threads.
 */
public final class OperandValidator {
    private final OperandBounds bounds;

    public OperandValidator(OperandBounds bounds) {
        if (bounds == null) {
            throw new IllegalArgumentException("Bounds must not be null");
        }
        this.bounds = bounds;
    }

    public OperandBounds bounds() {
        return bounds;
    }

    /**
     * Validates already-typed operands.
     *
     * @throws InvalidInputException if any operand is null or out of range
     */
    public void validate(Operand... operands) {
        for (Operand operand : operands) {
            if (operand == null) {
                throw new InvalidInputException(Operand.NOT_NUMERIC);
            }
            checkRange(operand);
        }
    }

    /**
     * Converts each value with {@link Operand#of(Object)} and validates it.
     *
     * @return the converted operands, in argument order
     * @throws InvalidInputException if any value is not numeric or out of range
     */
    public Operand[] validate(Object... values) {
        Operand[] operands = new Operand[values.length];
        for (int i = 0; i < values.length; i++) {
            operands[i] = Operand.of(values[i]);
            checkRange(operands[i]);
        }
        return operands;
    }

    private void checkRange(Operand operand) {
        boolean inRange = operand.kind() == Operand.Kind.INTEGER
                ? bounds.contains(operand.longValue())
                : bounds.contains(operand.doubleValue());
        if (!inRange) {
            throw new InvalidInputException("Input " + operand + " outside allowed range " + bounds);
        }
    }
}
