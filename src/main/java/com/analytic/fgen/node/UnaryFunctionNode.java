package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.fn.Fn1;

import java.util.List;
import java.util.Objects;

/**
 * A generic node that wraps an {@link Fn1}.
 * Use this to avoid creating specific *Node classes for every single function
 * ({@code sin}, {@code cos}, {@code sqrt}, {@code erf}, ...).
 */
public final class UnaryFunctionNode extends AbstractGenerator {
    private final Fn1 fn;
    private final FieldGenerator arg;

    /** Prototype. */
    public UnaryFunctionNode(String name, Fn1 fn) {
        this(name, fn, null);
    }

    public UnaryFunctionNode(String name, Fn1 fn, FieldGenerator arg) {
        super(name, GeneratorType.UNARY);
        this.fn = Objects.requireNonNull(fn, "fn");
        this.arg = arg;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new UnaryFunctionNode(name(), fn, args.get(0));
    }

    @Override
    public double generate(Context pos) {
        return fn.apply(arg.generate(pos));
    }

    @Override
    public List<FieldGenerator> args() {
        return present(arg);
    }

    @Override
    public String str() {
        return call(name(), arg);
    }
}
