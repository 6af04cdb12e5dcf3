package com.analytic.fgen.io;

import com.analytic.fgen.api.ArityException;
import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.api.GeometricMetadata;
import com.analytic.fgen.api.ParseException;
import com.analytic.fgen.node.BallooningNode;
import com.analytic.fgen.node.ConstantNode;
import com.analytic.fgen.node.MixmodeNode;
import com.analytic.fgen.util.MutableScalar;

import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

public class GeneratorFactoryTest {
    private final GeneratorFactory f = new GeneratorFactory(GeometricMetadata.uniform(0.1));

    @Test
    public void testBuildsSinPlusGauss() {
        // sin(x) + gauss(y, 0.2)
        FieldGenerator g = f.create("+",
                f.create("sin", f.create("x")),
                f.create("gauss", f.create("y"), new ConstantNode(0.2)));

        Context pos = Context.of(0.3, 0.1, 0.0);
        double expected = Math.sin(0.3) + Math.exp(-0.125) / (Math.sqrt(2 * Math.PI) * 0.2);
        assertEquals(expected, g.generate(pos), 1e-12);
        assertEquals("(sin(x)+gauss(y,0.2))", g.str());
    }

    @Test
    public void testBuiltInsRegistered() {
        for (String name : List.of("x", "y", "z", "t", "pi", "sin", "cos", "tan", "acos", "asin", "sinh", "cosh",
                "tanh", "exp", "log", "sqrt", "abs", "h", "erf", "pow", "fmod", "+", "-", "*", "/", "^", "atan",
                "gauss", "min", "max", "round", "tanhhat", "ballooning", "mixmode")) {
            assertTrue("missing " + name, f.contains(name));
        }
    }

    @Test
    public void testNamesAreCaseInsensitive() {
        FieldGenerator g = f.create("SIN", f.create("Pi"));
        assertEquals(0.0, g.generate(Context.ORIGIN), 1e-15);
    }

    @Test
    public void testUnknownFunction() {
        try {
            f.create("nosuch", f.create("x"));
            fail("Should throw ParseException");
        } catch (ArityException e) {
            fail("Unknown names are not arity errors");
        } catch (ParseException e) {
            assertTrue(e.getMessage().contains("nosuch"));
        }
    }

    @Test
    public void testArityErrorsSurface() {
        try {
            f.create("tanhhat", f.create("x"), f.create("y"));
            fail("Should throw ArityException");
        } catch (ArityException e) {
            assertEquals("tanhhat", e.function());
            assertEquals("4", e.expected());
            assertEquals(2, e.actual());
        }
    }

    @Test
    public void testBallooningUnavailableWithoutMetadata() {
        GeneratorFactory plain = new GeneratorFactory();
        assertFalse(plain.contains("ballooning"));
        try {
            plain.create("ballooning", plain.create("y"));
            fail("Should throw ParseException");
        } catch (ParseException e) {
            assertTrue(e.getMessage().contains("ballooning"));
        }
    }

    @Test
    public void testFmodAndPower() {
        assertEquals(1.5, f.create("fmod", new ConstantNode(5.5), new ConstantNode(2.0))
                .generate(Context.ORIGIN), 0.0);
        assertEquals(9.0, f.create("^", new ConstantNode(3.0), new ConstantNode(2.0))
                .generate(Context.ORIGIN), 0.0);
    }

    @Test
    public void testConfiguredDefaults() {
        GeneratorFactory custom = new GeneratorFactory(GeometricMetadata.open(), 1, 4.0);
        assertEquals(1, ((BallooningNode) custom.prototype("ballooning")).copies());
        MixmodeNode bound = (MixmodeNode) custom.create("mixmode", custom.create("z"));
        assertEquals(4.0, bound.seed(), 0.0);
    }

    @Test
    public void testRegisterScalarAndCustomPrototype() {
        MutableScalar amp = new MutableScalar(3.0);
        f.registerScalar("amp", amp);
        f.register("double", new com.analytic.fgen.node.UnaryFunctionNode("double", v -> 2 * v));

        FieldGenerator g = f.create("double", f.create("amp"));
        assertEquals(6.0, g.generate(Context.ORIGIN), 0.0);
        amp.update(5.0);
        assertEquals(10.0, g.generate(Context.ORIGIN), 0.0);
        assertEquals(GeneratorType.VALUE_REF, f.prototype("amp").type());
        assertTrue(f.names().contains("double"));
    }

    @Test
    public void testPrototypeUnchangedByCreate() {
        FieldGenerator prototype = f.prototype("sin");
        f.create("sin", f.create("x"));
        assertTrue(prototype.args().isEmpty());
    }
}
