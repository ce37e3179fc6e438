package com.bounded.calc.core;

/**
 * Thrown by division when the denominator is exactly zero.
 * Only raised after both operands have passed validation.
 */
public class DivisionByZeroException extends ArithmeticException {

    public DivisionByZeroException() {
        super("Cannot divide by zero");
    }
}
