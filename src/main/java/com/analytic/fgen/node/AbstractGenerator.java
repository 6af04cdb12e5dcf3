package com.analytic.fgen.node;

import com.analytic.fgen.api.ArityException;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Abstract base class for all node kinds.
 *
 * Design:
 * - Template Method: {@link #clone(List)} is final. It checks the argument
 * count against the kind's {@link com.analytic.fgen.api.Arity}, takes an
 * immutable copy of the list, and only then hands over to {@link #bind(List)}.
 * Subclasses never see an argument list of the wrong size.
 * - Immutability: subclasses keep their arguments in final fields.
 *
 * Subclassing:
 * Implement {@link #bind(List)} to build the bound node, and
 * {@link #generate(com.analytic.fgen.api.Context)} to evaluate it.
 */
@Log4j2
public abstract class AbstractGenerator implements FieldGenerator {
    private final String name;
    private final GeneratorType type;

    protected AbstractGenerator(String name, GeneratorType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    /** Function name this node was registered and is rendered under. */
    public final String name() {
        return name;
    }

    @Override
    public final GeneratorType type() {
        return type;
    }

    @Override
    public final FieldGenerator clone(List<FieldGenerator> args) {
        Objects.requireNonNull(args, "args");
        try {
            type.arity().check(name, args.size());
        } catch (ArityException e) {
            log.debug("Rejected call to {}: {}", name, e.getMessage());
            throw e;
        }
        return bind(List.copyOf(args));
    }

    /**
     * Builds the bound node.
     *
     * @param args Immutable, null-free, size already checked.
     */
    protected abstract FieldGenerator bind(List<FieldGenerator> args);

    @Override
    public String str() {
        return name + "()";
    }

    @Override
    public String toString() {
        return str();
    }

    /** Non-null entries of {@code args}, in order. */
    protected static List<FieldGenerator> present(FieldGenerator... args) {
        List<FieldGenerator> result = new ArrayList<>(args.length);
        for (FieldGenerator a : args) {
            if (a != null)
                result.add(a);
        }
        return Collections.unmodifiableList(result);
    }

    /** Renders {@code name(a,b,...)}. Unbound arguments render as "?". */
    protected static String call(String name, FieldGenerator... args) {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i > 0)
                sb.append(',');
            sb.append(args[i] == null ? "?" : args[i].str());
        }
        return sb.append(')').toString();
    }
}
