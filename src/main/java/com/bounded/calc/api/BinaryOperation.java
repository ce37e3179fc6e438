package com.bounded.calc.api;

/**
 * An arithmetic function of two operands.
 *
 * <p>
 * Implementations validate both operands before computing, so a returned
 * value always comes from in-range inputs.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (a, b) -> a + b}</li>
 * <li>{@code (a, b) -> a / b}</li>
 * </ul>
 */
@FunctionalInterface
public interface BinaryOperation {
    /**
     * Applies the operation.
     *
     * @param a Left operand.
     * @param b Right operand.
     * @return The result. Never range-checked.
     */
    Operand apply(Operand a, Operand b);
}
