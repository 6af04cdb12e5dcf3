package com.analytic.fgen.io;

import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeometricMetadata;
import com.analytic.fgen.api.ParseException;
import com.analytic.fgen.fn.Fn1;
import com.analytic.fgen.fn.Fn2;
import com.analytic.fgen.fn.analytic.Erf;
import com.analytic.fgen.fn.analytic.Heaviside;
import com.analytic.fgen.node.AtanNode;
import com.analytic.fgen.node.BallooningNode;
import com.analytic.fgen.node.BinaryFunctionNode;
import com.analytic.fgen.node.ConstantNode;
import com.analytic.fgen.node.CoordinateNode;
import com.analytic.fgen.node.GaussianNode;
import com.analytic.fgen.node.MixmodeNode;
import com.analytic.fgen.node.RoundNode;
import com.analytic.fgen.node.TanhHatNode;
import com.analytic.fgen.node.UnaryFunctionNode;
import com.analytic.fgen.node.ValueRefNode;
import com.analytic.fgen.node.VariadicFunctionNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.DoubleSupplier;

import lombok.extern.log4j.Log4j2;

/**
 * Registry mapping function names to prototype generators.
 *
 * <p>
 * Each name is registered once with an unbound prototype. {@link #create}
 * looks the prototype up and clones it with the given arguments, which is
 * where the argument count is validated. Names are case-insensitive.
 *
 * <p>
 * Registration is not thread-safe; register everything before sharing the
 * factory between threads. Lookups and {@code create} may then run
 * concurrently.
 */
@Log4j2
public final class GeneratorFactory {
    private final Map<String, FieldGenerator> prototypes = new HashMap<>();
    private final GeometricMetadata metadata;
    private final int ballooningCopies;
    private final double mixmodeSeed;

    public GeneratorFactory() {
        this(null);
    }

    /**
     * @param metadata Geometry for {@code ballooning}; may be null, in which case
     *                 {@code ballooning} is not registered and calling it is a
     *                 parse error.
     */
    public GeneratorFactory(GeometricMetadata metadata) {
        this(metadata, BallooningNode.DEFAULT_COPIES, MixmodeNode.DEFAULT_SEED);
    }

    public GeneratorFactory(GeometricMetadata metadata, int ballooningCopies, double mixmodeSeed) {
        this.metadata = metadata;
        this.ballooningCopies = ballooningCopies;
        this.mixmodeSeed = mixmodeSeed;
        registerBuiltIns();
    }

    /**
     * Registers (or replaces) the prototype for {@code name}.
     */
    public GeneratorFactory register(String name, FieldGenerator prototype) {
        Objects.requireNonNull(prototype, "prototype");
        String key = key(name);
        if (prototypes.put(key, prototype) != null)
            log.debug("Replaced prototype for '{}' with {}", key, prototype.type());
        else
            log.debug("Registered prototype '{}' ({})", key, prototype.type());
        return this;
    }

    /**
     * Registers a leaf reading a caller-owned scalar under {@code name}.
     */
    public GeneratorFactory registerScalar(String name, DoubleSupplier ref) {
        return register(name, new ValueRefNode(key(name), ref));
    }

    public boolean contains(String name) {
        return name != null && prototypes.containsKey(key(name));
    }

    /**
     * @return The prototype registered under {@code name}, or null.
     */
    public FieldGenerator prototype(String name) {
        return name == null ? null : prototypes.get(key(name));
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(prototypes.keySet()));
    }

    /**
     * Builds a bound node for the call {@code name(args...)}.
     *
     * @throws ParseException if no prototype is registered under {@code name}
     * @throws com.analytic.fgen.api.ArityException if the prototype does not
     *         accept {@code args.size()} arguments
     */
    public FieldGenerator create(String name, List<FieldGenerator> args) {
        FieldGenerator prototype = prototype(name);
        if (prototype == null)
            throw new ParseException("Couldn't find generator '" + name + "'");
        return prototype.clone(args);
    }

    public FieldGenerator create(String name, FieldGenerator... args) {
        return create(name, Arrays.asList(args));
    }

    private static String key(String name) {
        Objects.requireNonNull(name, "name");
        return name.toLowerCase(Locale.ROOT);
    }

    // ── Built-in prototypes ──────────────────────────────────────────

    private void registerBuiltIns() {
        // --- Leaves ---
        register("x", new CoordinateNode(CoordinateNode.Axis.X));
        register("y", new CoordinateNode(CoordinateNode.Axis.Y));
        register("z", new CoordinateNode(CoordinateNode.Axis.Z));
        register("t", new CoordinateNode(CoordinateNode.Axis.T));
        register("pi", new ConstantNode("pi", Math.PI));

        // --- Fn1 nodes (1 argument) ---
        registerFn1("sin", Math::sin);
        registerFn1("cos", Math::cos);
        registerFn1("tan", Math::tan);
        registerFn1("acos", Math::acos);
        registerFn1("asin", Math::asin);
        registerFn1("sinh", Math::sinh);
        registerFn1("cosh", Math::cosh);
        registerFn1("tanh", Math::tanh);
        registerFn1("exp", Math::exp);
        registerFn1("log", Math::log);
        registerFn1("sqrt", Math::sqrt);
        registerFn1("abs", Math::abs);
        registerFn1("h", Heaviside.INSTANCE);
        registerFn1("erf", Erf.INSTANCE);

        // --- Fn2 nodes (2 arguments) ---
        registerFn2("pow", Math::pow);
        registerFn2("fmod", (a, b) -> a % b);
        registerFn2("+", (a, b) -> a + b);
        registerFn2("-", (a, b) -> a - b);
        registerFn2("*", (a, b) -> a * b);
        registerFn2("/", (a, b) -> a / b);
        registerFn2("^", Math::pow);

        // --- Bespoke arity ---
        register("atan", new AtanNode());
        register("gauss", new GaussianNode());
        register("min", VariadicFunctionNode.min());
        register("max", VariadicFunctionNode.max());
        register("round", new RoundNode());
        register("tanhhat", new TanhHatNode());

        // --- Transforms ---
        if (metadata != null)
            register("ballooning", new BallooningNode(metadata, null, ballooningCopies));
        else
            log.debug("No geometric metadata; 'ballooning' not registered");
        register("mixmode", new MixmodeNode(null, mixmodeSeed));
    }

    private void registerFn1(String name, Fn1 fn) {
        register(name, new UnaryFunctionNode(name, fn));
    }

    private void registerFn2(String name, Fn2 fn) {
        register(name, new BinaryFunctionNode(name, fn));
    }
}
