package com.analytic.fgen.io;

import com.analytic.fgen.api.ArityException;
import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.ParseException;
import com.analytic.fgen.util.MutableScalar;

import java.nio.file.Path;

import org.junit.Test;

import static org.junit.Assert.*;

public class JsonExpressionCompilerTest {

    private static Path resource(String name) throws Exception {
        return Path.of(JsonExpressionCompilerTest.class.getResource(name).toURI());
    }

    @Test
    public void testCompileFile() throws Exception {
        MutableScalar amplitude = new MutableScalar(2.0);
        JsonExpressionCompiler compiler = new JsonExpressionCompiler().bindScalar("amplitude", amplitude);

        JsonExpressionCompiler.CompiledExpressions compiled = compiler
                .compile(JsonExpressionCompiler.parseFile(resource("/initial_conditions.json")));

        assertEquals(java.util.List.of("density", "perturbation", "total"), compiled.order());
        assertEquals("Background density with a Gaussian bump in y", compiled.descriptions().get("density"));
        assertFalse(compiled.descriptions().containsKey("perturbation"));

        FieldGenerator density = compiled.get("density");
        FieldGenerator perturbation = compiled.get("perturbation");
        FieldGenerator total = compiled.get("total");

        Context pos = Context.of(0.3, 0.1, 1.7);
        double expectedDensity = Math.sin(0.3) + Math.exp(-0.125) / (Math.sqrt(2 * Math.PI) * 0.2);
        assertEquals(expectedDensity, density.generate(pos), 1e-12);
        assertEquals(density.generate(pos) + perturbation.generate(pos), total.generate(pos), 1e-12);

        // Shared, not copied
        assertSame(density, total.args().get(0));
        assertSame(perturbation, total.args().get(1));

        // Live scalar
        double before = perturbation.generate(pos);
        amplitude.update(4.0);
        assertEquals(2.0 * before, perturbation.generate(pos), 1e-12);
    }

    @Test
    public void testUnresolvedReference() {
        String json = "{\"expressions\":[{\"name\":\"a\",\"root\":{\"ref\":\"missing\"}}]}";
        try {
            new JsonExpressionCompiler().compile(json);
            fail("Should throw ParseException");
        } catch (ParseException e) {
            assertTrue(e.getMessage().contains("missing"));
        }
    }

    @Test
    public void testArityErrorPropagates() {
        String json = "{\"expressions\":[{\"name\":\"a\",\"root\":{\"fn\":\"atan\",\"args\":["
                + "{\"value\":1},{\"value\":2},{\"value\":3}]}}]}";
        try {
            new JsonExpressionCompiler().compile(json);
            fail("Should throw ArityException");
        } catch (ArityException e) {
            assertEquals("atan", e.function());
            assertEquals(3, e.actual());
        }
    }

    @Test
    public void testCallWithoutArgsList() {
        String json = "{\"expressions\":[{\"name\":\"a\",\"root\":{\"fn\":\"sin\"}}]}";
        try {
            new JsonExpressionCompiler().compile(json);
            fail("Should throw ArityException");
        } catch (ArityException e) {
            assertEquals(0, e.actual());
        }
    }

    @Test(expected = ParseException.class)
    public void testAmbiguousNode() {
        new JsonExpressionCompiler()
                .compile("{\"expressions\":[{\"name\":\"a\",\"root\":{\"fn\":\"x\",\"value\":1}}]}");
    }

    @Test(expected = ParseException.class)
    public void testDuplicateNames() {
        new JsonExpressionCompiler().compile("{\"expressions\":["
                + "{\"name\":\"a\",\"root\":{\"value\":1}},"
                + "{\"name\":\"a\",\"root\":{\"value\":2}}]}");
    }

    @Test(expected = ParseException.class)
    public void testMissingName() {
        new JsonExpressionCompiler().compile("{\"expressions\":[{\"root\":{\"value\":1}}]}");
    }

    @Test(expected = ParseException.class)
    public void testInvalidJson() {
        new JsonExpressionCompiler().compile("{\"expressions\": [");
    }

    @Test
    public void testEmptyDocument() {
        assertTrue(new JsonExpressionCompiler().compile("{}").order().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGetUnknownExpression() {
        new JsonExpressionCompiler().compile("{}").get("nothing");
    }

    @Test
    public void testBuildSingleNode() {
        ExpressionDefinition.CallDef x = new ExpressionDefinition.CallDef();
        x.setFn("x");
        ExpressionDefinition.CallDef round = new ExpressionDefinition.CallDef();
        round.setFn("round");
        round.setArgs(java.util.List.of(x));

        FieldGenerator g = new JsonExpressionCompiler().build(round);
        assertEquals(-3.0, g.generate(Context.of(-2.5, 0, 0)), 0.0);
    }
}
