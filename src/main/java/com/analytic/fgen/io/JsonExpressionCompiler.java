package com.analytic.fgen.io;

import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.ParseException;
import com.analytic.fgen.node.ConstantNode;
import com.analytic.fgen.node.ValueRefNode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleSupplier;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link ExpressionDefinition} into bound generator trees.
 *
 * <p>
 * Trees are built bottom-up: the arguments of a call are built first, then the
 * call's prototype is cloned with them through the {@link GeneratorFactory}.
 * A {@code ref} resolves to a scalar bound with {@link #bindScalar} or, failing
 * that, to an expression defined earlier in the same document; in the latter
 * case the sub-tree is shared, not copied.
 */
@Log4j2
public final class JsonExpressionCompiler {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final GeneratorFactory factory;
    private final Map<String, DoubleSupplier> scalars = new HashMap<>();

    public JsonExpressionCompiler() {
        this(new GeneratorFactory());
    }

    public JsonExpressionCompiler(GeneratorFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Makes {@code {"ref": name}} resolve to a live reference to {@code ref}.
     */
    public JsonExpressionCompiler bindScalar(String name, DoubleSupplier ref) {
        scalars.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(ref, "ref"));
        return this;
    }

    /** Parses a JSON string into an ExpressionDefinition. */
    public static ExpressionDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, ExpressionDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ParseException("Invalid expression document: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON file into an ExpressionDefinition. */
    public static ExpressionDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public CompiledExpressions compile(String json) {
        return compile(parse(json));
    }

    /**
     * Compiles every expression of the definition, in document order.
     *
     * @throws ParseException on the first malformed expression; nothing is
     *                        returned for the others
     */
    public CompiledExpressions compile(ExpressionDefinition def) {
        List<ExpressionDefinition.ExpressionDef> defs = def.getExpressions() != null
                ? def.getExpressions()
                : List.of();

        Map<String, FieldGenerator> byName = new LinkedHashMap<>(defs.size() * 2);
        Map<String, String> descriptions = new HashMap<>(defs.size() * 2);
        List<String> order = new ArrayList<>(defs.size());

        for (ExpressionDefinition.ExpressionDef ed : defs) {
            String name = ed.getName();
            if (name == null || name.isBlank())
                throw new ParseException("Expression without a name");
            if (byName.containsKey(name))
                throw new ParseException("Duplicate expression '" + name + "'");
            if (ed.getRoot() == null)
                throw new ParseException("Expression '" + name + "' has no root");

            FieldGenerator root;
            try {
                root = build(ed.getRoot(), byName);
            } catch (ParseException e) {
                log.debug("Failed to compile expression '{}': {}", name, e.getMessage());
                throw e;
            }
            byName.put(name, root);
            order.add(name);
            if (ed.getDescription() != null)
                descriptions.put(name, ed.getDescription());
        }

        log.info("Compiled {} expression(s)", order.size());
        return new CompiledExpressions(Collections.unmodifiableMap(byName),
                Collections.unmodifiableMap(descriptions),
                Collections.unmodifiableList(order));
    }

    /** Builds a single tree, with no earlier expressions in scope. */
    public FieldGenerator build(ExpressionDefinition.CallDef node) {
        return build(node, Map.of());
    }

    private FieldGenerator build(ExpressionDefinition.CallDef node, Map<String, FieldGenerator> earlier) {
        if (node == null)
            throw new ParseException("Empty expression node");

        int kinds = (node.getFn() != null ? 1 : 0) + (node.getValue() != null ? 1 : 0)
                + (node.getRef() != null ? 1 : 0);
        if (kinds != 1)
            throw new ParseException("Expression node must have exactly one of 'fn', 'value', 'ref': " + node);

        if (node.getValue() != null)
            return new ConstantNode(node.getValue());

        if (node.getRef() != null) {
            String ref = node.getRef();
            DoubleSupplier scalar = scalars.get(ref);
            if (scalar != null)
                return new ValueRefNode(ref, scalar);
            FieldGenerator shared = earlier.get(ref);
            if (shared != null)
                return shared;
            throw new ParseException("Unresolved reference '" + ref + "'");
        }

        List<ExpressionDefinition.CallDef> argDefs = node.getArgs() != null ? node.getArgs() : List.of();
        List<FieldGenerator> args = new ArrayList<>(argDefs.size());
        for (ExpressionDefinition.CallDef a : argDefs)
            args.add(build(a, earlier));
        return factory.create(node.getFn(), args);
    }

    /** The result of compilation: bound trees by name. */
    public record CompiledExpressions(Map<String, FieldGenerator> byName, Map<String, String> descriptions,
            List<String> order) {

        /**
         * @throws IllegalArgumentException if there is no expression called
         *                                  {@code name}
         */
        public FieldGenerator get(String name) {
            FieldGenerator g = byName.get(name);
            if (g == null)
                throw new IllegalArgumentException("No expression named '" + name + "'");
            return g;
        }
    }
}
