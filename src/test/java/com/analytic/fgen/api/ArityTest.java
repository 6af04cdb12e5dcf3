package com.analytic.fgen.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class ArityTest {

    @Test
    public void testDescribe() {
        assertEquals("1", Arity.exactly(1).describe());
        assertEquals("1 or 2", Arity.between(1, 2).describe());
        assertEquals("at least 1", Arity.atLeast(1).describe());
        assertEquals("between 2 and 5", Arity.between(2, 5).describe());
    }

    @Test
    public void testAccepts() {
        Arity oneOrTwo = Arity.between(1, 2);
        assertFalse(oneOrTwo.accepts(0));
        assertTrue(oneOrTwo.accepts(1));
        assertTrue(oneOrTwo.accepts(2));
        assertFalse(oneOrTwo.accepts(3));
        assertTrue(Arity.any().accepts(0));
        assertTrue(Arity.atLeast(1).accepts(1000));
    }

    @Test
    public void testCheckReportsExpectedAndActual() {
        try {
            Arity.exactly(4).check("tanhhat", 3);
            fail("Should throw ArityException");
        } catch (ArityException e) {
            assertEquals("tanhhat", e.function());
            assertEquals("4", e.expected());
            assertEquals(3, e.actual());
            assertEquals("Incorrect number of arguments to tanhhat function. Expecting 4, got 3", e.getMessage());
        }
    }

    @Test
    public void testNoInputsMessage() {
        try {
            Arity.atLeast(1).check("max", 0);
            fail("Should throw ArityException");
        } catch (ArityException e) {
            assertTrue(e.getMessage().startsWith("max function must have some inputs"));
            assertEquals("at least 1", e.expected());
            assertEquals(0, e.actual());
        }
    }

    @Test
    public void testArityExceptionIsParseException() {
        assertTrue(new ArityException("sin", "1", 2) instanceof ParseException);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRange() {
        Arity.between(3, 2);
    }
}
