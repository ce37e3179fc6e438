package com.bounded.calc.fn;

import com.bounded.calc.api.Operand;
import com.bounded.calc.core.OperandValidator;

/**
 * Non-commutative difference.
 *
 * y = minuend - subtrahend
 */
public class Subtract extends AbstractBinaryOperation {

    public Subtract(OperandValidator validator) {
        super(validator);
    }

    @Override
    protected Operand calculate(Operand minuend, Operand subtrahend) {
        if (bothIntegers(minuend, subtrahend)) {
            return Operand.ofLong(Math.subtractExact(minuend.longValue(), subtrahend.longValue()));
        }
        return Operand.ofDouble(minuend.doubleValue() - subtrahend.doubleValue());
    }
}
