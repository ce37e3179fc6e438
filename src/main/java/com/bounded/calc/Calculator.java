package com.bounded.calc;

import com.bounded.calc.api.BinaryOperation;
import com.bounded.calc.api.Operand;
import com.bounded.calc.api.Operation;
import com.bounded.calc.core.DivisionByZeroException;
import com.bounded.calc.core.InvalidInputException;
import com.bounded.calc.core.OperandBounds;
import com.bounded.calc.core.OperandValidator;
import lombok.extern.log4j.Log4j2;

import java.util.EnumMap;
import java.util.Map;

/**
 * Four-function calculator whose operands are range-checked before every
 * operation.
 *
 * <p>
 * Usage:
 * <pre>{@code
 * var calc = new Calculator();
 * long sum = calc.add(5, 3);          // 8
 * double q = calc.divide(7, 2);       // 3.5
 * calc.add(Calculator.MAX_VALUE + 1, 0); // InvalidInputException
 * }</pre>
 *
 * <p>
 * Integer overloads stay exact; any floating operand switches to double
 * arithmetic. Division always produces a double. Results are never
 * range-checked.
 *
 * <p>
 * A calculator holds no mutable state and may be shared between threads.
 */
@Log4j2
public final class Calculator {

    /** Lowest accepted operand under the standard bounds. */
    public static final long MIN_VALUE = OperandBounds.STANDARD.min();
    /** Highest accepted operand under the standard bounds. */
    public static final long MAX_VALUE = OperandBounds.STANDARD.max();

    private final OperandValidator validator;
    private final Map<Operation, BinaryOperation> operations;

    public Calculator() {
        this(OperandBounds.STANDARD);
    }

    public Calculator(OperandBounds bounds) {
        this.validator = new OperandValidator(bounds);
        Map<Operation, BinaryOperation> ops = new EnumMap<>(Operation.class);
        for (Operation op : Operation.values()) {
            ops.put(op, op.create(validator));
        }
        this.operations = ops;
        log.debug("Calculator created with operand bounds {}", bounds);
    }

    public OperandBounds bounds() {
        return validator.bounds();
    }

    // ---- Validation ----

    /**
     * @throws InvalidInputException if any value is not numeric or is out of
     *                               range
     */
    public void validate(Object... values) {
        validator.validate(values);
    }

    public void validate(Operand... operands) {
        validator.validate(operands);
    }

    // ---- Generic entry points ----

    public Operand apply(Operation operation, Operand a, Operand b) {
        return lookup(operation).apply(a, b);
    }

    /**
     * Applies an operation to dynamically typed values, converting them with
     * {@link Operand#of(Object)}.
     *
     * @throws InvalidInputException   if either value is rejected
     * @throws DivisionByZeroException if dividing by exactly zero
     */
    public Operand apply(Operation operation, Object a, Object b) {
        BinaryOperation op = lookup(operation);
        Operand[] operands;
        try {
            operands = validator.validate(a, b);
        } catch (InvalidInputException e) {
            if (log.isDebugEnabled()) {
                log.debug("{} rejected ({}, {}): {}", operation, a, b, e.getMessage());
            }
            throw e;
        }
        return op.apply(operands[0], operands[1]);
    }

    private BinaryOperation lookup(Operation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("Unknown operation: null");
        }
        return operations.get(operation);
    }

    // ---- Operand overloads ----

    public Operand add(Operand a, Operand b) {
        return apply(Operation.ADD, a, b);
    }

    public Operand subtract(Operand a, Operand b) {
        return apply(Operation.SUBTRACT, a, b);
    }

    public Operand multiply(Operand a, Operand b) {
        return apply(Operation.MULTIPLY, a, b);
    }

    public Operand divide(Operand a, Operand b) {
        return apply(Operation.DIVIDE, a, b);
    }

    // ---- Primitive overloads ----

    public long add(long a, long b) {
        return add(Operand.ofLong(a), Operand.ofLong(b)).longValue();
    }

    public double add(double a, double b) {
        return add(Operand.ofDouble(a), Operand.ofDouble(b)).doubleValue();
    }

    public long subtract(long a, long b) {
        return subtract(Operand.ofLong(a), Operand.ofLong(b)).longValue();
    }

    public double subtract(double a, double b) {
        return subtract(Operand.ofDouble(a), Operand.ofDouble(b)).doubleValue();
    }

    public long multiply(long a, long b) {
        return multiply(Operand.ofLong(a), Operand.ofLong(b)).longValue();
    }

    public double multiply(double a, double b) {
        return multiply(Operand.ofDouble(a), Operand.ofDouble(b)).doubleValue();
    }

    public double divide(long a, long b) {
        return divide(Operand.ofLong(a), Operand.ofLong(b)).doubleValue();
    }

    public double divide(double a, double b) {
        return divide(Operand.ofDouble(a), Operand.ofDouble(b)).doubleValue();
    }
}
