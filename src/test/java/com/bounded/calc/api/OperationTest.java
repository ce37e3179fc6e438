package com.bounded.calc.api;

import com.bounded.calc.core.OperandBounds;
import com.bounded.calc.core.OperandValidator;
import com.bounded.calc.fn.Divide;
import org.junit.Test;

import static org.junit.Assert.*;

public class OperationTest {

    @Test
    public void testFromSymbol() {
        assertEquals(Operation.ADD, Operation.fromSymbol("+"));
        assertEquals(Operation.SUBTRACT, Operation.fromSymbol("-"));
        assertEquals(Operation.MULTIPLY, Operation.fromSymbol("*"));
        assertEquals(Operation.DIVIDE, Operation.fromSymbol("/"));
    }

    @Test
    public void testUnknownSymbol() {
        try {
            Operation.fromSymbol("%");
            fail("Should throw IllegalArgumentException for unknown symbol");
        } catch (IllegalArgumentException e) {
            assertEquals("Unknown operation symbol: %", e.getMessage());
        }
    }

    @Test
    public void testFromName() {
        assertEquals(Operation.DIVIDE, Operation.fromName("divide"));
        assertEquals(Operation.MULTIPLY, Operation.fromName(" Multiply "));
        assertThrows(IllegalArgumentException.class, () -> Operation.fromName("modulo"));
        assertThrows(IllegalArgumentException.class, () -> Operation.fromName(null));
    }

    @Test
    public void testCreateBuildsOperation() {
        BinaryOperation div = Operation.DIVIDE.create(new OperandValidator(OperandBounds.STANDARD));
        assertTrue(div instanceof Divide);
        assertEquals(Operand.ofDouble(3.5), div.apply(Operand.ofLong(7), Operand.ofLong(2)));
    }
}
