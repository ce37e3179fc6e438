package com.bounded.calc.core;

/**
 * Thrown when an operand is not numeric or lies outside the configured
 * {@link OperandBounds}. Always raised before any arithmetic runs.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
