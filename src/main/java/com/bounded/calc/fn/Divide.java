package com.bounded.calc.fn;

import com.bounded.calc.api.Operand;
import com.bounded.calc.core.DivisionByZeroException;
import com.bounded.calc.core.OperandValidator;

/**
 * True division; integer operands still produce a floating quotient.
 *
 * y = numerator / denominator
 */
public class Divide extends AbstractBinaryOperation {

    public Divide(OperandValidator validator) {
        super(validator);
    }

    @Override
    protected Operand calculate(Operand numerator, Operand denominator) {
        if (denominator.isZero()) {
            throw new DivisionByZeroException();
        }
        return Operand.ofDouble(numerator.doubleValue() / denominator.doubleValue());
    }
}
