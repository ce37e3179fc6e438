package com.bounded.calc.core;

import com.bounded.calc.api.Operand;
import org.junit.Test;

import static org.junit.Assert.*;

public class OperandValidatorTest {

    private final OperandValidator validator = new OperandValidator(OperandBounds.STANDARD);

    @Test
    public void testBoundaryValuesAccepted() {
        validator.validate(Operand.ofLong(-1_000_000), Operand.ofLong(1_000_000));
        validator.validate(Operand.ofDouble(-1_000_000.0), Operand.ofDouble(1_000_000.0));
    }

    @Test
    public void testConvertsDynamicValues() {
        Operand[] ops = validator.validate(3, 4.5, true);
        assertArrayEquals(new Operand[] { Operand.ofLong(3), Operand.ofDouble(4.5), Operand.ofLong(1) }, ops);
    }

    @Test
    public void testOutOfRangeMessage() {
        try {
            validator.validate(Operand.ofLong(0), Operand.ofLong(-1_000_001));
            fail("Should reject value below min");
        } catch (InvalidInputException e) {
            assertEquals("Input -1000001 outside allowed range [-1000000, 1000000]", e.getMessage());
        }
    }

    @Test
    public void testNonFiniteRejected() {
        double[] values = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY };
        for (double v : values) {
            try {
                validator.validate(Operand.ofDouble(v));
                fail("Should reject " + v);
            } catch (InvalidInputException e) {
                assertTrue(e.getMessage().contains("outside allowed range"));
            }
        }
    }

    @Test
    public void testNullOperandRejected() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> validator.validate(Operand.ofLong(1), null));
        assertEquals("Inputs must be int or float", e.getMessage());
    }

    @Test
    public void testFirstFailureReported() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> validator.validate("text", 5_000_000));
        assertEquals("Inputs must be int or float", e.getMessage());

        e = assertThrows(InvalidInputException.class, () -> validator.validate(5_000_000, "text"));
        assertTrue(e.getMessage().contains("outside allowed range"));
    }

    @Test
    public void testInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new OperandBounds(10, -10));
        assertThrows(IllegalArgumentException.class, () -> new OperandValidator(null));
        assertEquals("[-1000000, 1000000]", OperandBounds.STANDARD.toString());
    }
}
