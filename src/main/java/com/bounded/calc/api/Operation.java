package com.bounded.calc.api;

import com.bounded.calc.core.OperandValidator;
import com.bounded.calc.fn.Add;
import com.bounded.calc.fn.Divide;
import com.bounded.calc.fn.Multiply;
import com.bounded.calc.fn.Subtract;

import java.util.Locale;
import java.util.function.Function;

/**
 * The four supported operations and the factories that build them.
 */
public enum Operation {
    ADD("+", Add::new),
    SUBTRACT("-", Subtract::new),
    MULTIPLY("*", Multiply::new),
    DIVIDE("/", Divide::new);

    private final String symbol;
    private final Function<OperandValidator, BinaryOperation> factory;

    Operation(String symbol, Function<OperandValidator, BinaryOperation> factory) {
        this.symbol = symbol;
        this.factory = factory;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Builds the function object for this operation, checking operands with
     * the given validator.
     */
    public BinaryOperation create(OperandValidator validator) {
        return factory.apply(validator);
    }

    public static Operation fromSymbol(String symbol) {
        for (Operation op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operation symbol: " + symbol);
    }

    /** Case-insensitive lookup by constant name, e.g. {@code "divide"}. */
    public static Operation fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Unknown operation name: null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown operation name: " + name, e);
        }
    }
}
