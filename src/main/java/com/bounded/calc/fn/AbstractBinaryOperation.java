package com.bounded.calc.fn;

import com.bounded.calc.api.BinaryOperation;
import com.bounded.calc.api.Operand;
import com.bounded.calc.core.OperandValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for two-operand arithmetic. Validates both operands first.
 * <p>
 * Formula: {@code y = f(a, b)}, evaluated only when {@code a} and {@code b}
 * are inside the validator's bounds.
 */
public abstract class AbstractBinaryOperation implements BinaryOperation {
    private final Logger log = LogManager.getLogger(this.getClass());
    private final OperandValidator validator;

    protected AbstractBinaryOperation(OperandValidator validator) {
        this.validator = validator;
    }

    @Override
    public final Operand apply(Operand a, Operand b) {
        try {
            validator.validate(a, b);
            return calculate(a, b);
        } catch (IllegalArgumentException | ArithmeticException e) {
            if (log.isDebugEnabled()) {
                log.debug("{} rejected ({}, {}): {}", getClass().getSimpleName(), a, b, e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Subclasses implement the arithmetic here. Both operands are validated.
     */
    protected abstract Operand calculate(Operand a, Operand b);

    /** True when both operands are integers, so the result can stay exact. */
    protected static boolean bothIntegers(Operand a, Operand b) {
        return a.isInteger() && b.isInteger();
    }
}
