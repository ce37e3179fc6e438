package com.bounded.calc.fn;

import com.bounded.calc.api.Operand;
import com.bounded.calc.core.OperandValidator;

/**
 * y = a + b
 */
public class Add extends AbstractBinaryOperation {

    public Add(OperandValidator validator) {
        super(validator);
    }

    @Override
    protected Operand calculate(Operand a, Operand b) {
        if (bothIntegers(a, b)) {
            return Operand.ofLong(Math.addExact(a.longValue(), b.longValue()));
        }
        return Operand.ofDouble(a.doubleValue() + b.doubleValue());
    }
}
