package com.bounded.calc.fn;

import com.bounded.calc.api.Operand;
import com.bounded.calc.core.OperandValidator;

/**
 * y = a * b
 * <p>
 * The product is not range-checked. With the standard bounds an integer
 * product fits comfortably in a long.
 */
public class Multiply extends AbstractBinaryOperation {

    public Multiply(OperandValidator validator) {
        super(validator);
    }

    @Override
    protected Operand calculate(Operand a, Operand b) {
        if (bothIntegers(a, b)) {
            return Operand.ofLong(Math.multiplyExact(a.longValue(), b.longValue()));
        }
        return Operand.ofDouble(a.doubleValue() * b.doubleValue());
    }
}
