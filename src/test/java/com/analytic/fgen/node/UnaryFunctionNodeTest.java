package com.analytic.fgen.node;

import com.analytic.fgen.api.ArityException;
import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.fn.analytic.Heaviside;

import java.util.List;

import org.junit.Test;

import static com.analytic.fgen.node.NodeFixtures.*;
import static org.junit.Assert.*;

public class UnaryFunctionNodeTest {
    private final UnaryFunctionNode sqrt = new UnaryFunctionNode("sqrt", Math::sqrt);

    @Test
    public void testEvaluate() {
        assertEquals(3.0, sqrt.clone(constants(9.0)).generate(Context.ORIGIN), 0.0);
    }

    @Test
    public void testArityErrors() {
        for (int n : new int[] { 0, 2, 3 }) {
            try {
                sqrt.clone(constants(new double[n]));
                fail("Should throw ArityException for " + n + " arguments");
            } catch (ArityException e) {
                assertEquals("sqrt", e.function());
                assertEquals("1", e.expected());
                assertEquals(n, e.actual());
            }
        }
    }

    @Test
    public void testDomainErrorsPropagateAsNaN() {
        double v = sqrt.clone(constants(-1.0)).generate(Context.ORIGIN);
        assertTrue(Double.isNaN(v));

        FieldGenerator log = new UnaryFunctionNode("log", Math::log).clone(constants(0.0));
        assertEquals(Double.NEGATIVE_INFINITY, log.generate(Context.ORIGIN), 0.0);
    }

    @Test
    public void testHeaviside() {
        UnaryFunctionNode h = new UnaryFunctionNode("h", Heaviside.INSTANCE);
        assertEquals(1.0, h.clone(constants(0.1)).generate(Context.ORIGIN), 0.0);
        assertEquals(0.0, h.clone(constants(0.0)).generate(Context.ORIGIN), 0.0);
        assertEquals(0.0, h.clone(constants(-3.0)).generate(Context.ORIGIN), 0.0);
    }

    @Test
    public void testCloneReturnsIndependentNodes() {
        FieldGenerator a = sqrt.clone(constants(4.0));
        FieldGenerator b = sqrt.clone(constants(16.0));
        assertNotSame(a, b);
        assertEquals(2.0, a.generate(Context.ORIGIN), 0.0);
        assertEquals(4.0, b.generate(Context.ORIGIN), 0.0);
        assertEquals(GeneratorType.UNARY, a.type());
    }

    @Test
    public void testStrAndArgs() {
        FieldGenerator bound = new UnaryFunctionNode("sin", Math::sin).clone(args(x()));
        assertEquals("sin(x)", bound.str());
        assertEquals(1, bound.args().size());
        assertEquals("sin(?)", new UnaryFunctionNode("sin", Math::sin).str());
    }

    @Test(expected = NullPointerException.class)
    public void testNullArgumentRejected() {
        sqrt.clone(java.util.Arrays.asList((FieldGenerator) null));
    }

    @Test(expected = NullPointerException.class)
    public void testNullListRejected() {
        sqrt.clone((List<FieldGenerator>) null);
    }
}
