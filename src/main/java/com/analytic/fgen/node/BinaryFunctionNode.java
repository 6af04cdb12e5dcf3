package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.fn.Fn2;

import java.util.List;
import java.util.Objects;

/**
 * A generic node that wraps an {@link Fn2}.
 *
 * <p>
 * Operands are evaluated left to right. Nodes registered under an operator
 * symbol ({@code +}, {@code ^}, ...) render infix, everything else as a call.
 */
public final class BinaryFunctionNode extends AbstractGenerator {
    private final Fn2 fn;
    private final FieldGenerator a;
    private final FieldGenerator b;

    /** Prototype. */
    public BinaryFunctionNode(String name, Fn2 fn) {
        this(name, fn, null, null);
    }

    public BinaryFunctionNode(String name, Fn2 fn, FieldGenerator a, FieldGenerator b) {
        super(name, GeneratorType.BINARY);
        this.fn = Objects.requireNonNull(fn, "fn");
        this.a = a;
        this.b = b;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new BinaryFunctionNode(name(), fn, args.get(0), args.get(1));
    }

    @Override
    public double generate(Context pos) {
        double left = a.generate(pos);
        return fn.apply(left, b.generate(pos));
    }

    @Override
    public List<FieldGenerator> args() {
        return present(a, b);
    }

    @Override
    public String str() {
        if (isOperator(name()))
            return "(" + (a == null ? "?" : a.str()) + name() + (b == null ? "?" : b.str()) + ")";
        return call(name(), a, b);
    }

    private static boolean isOperator(String name) {
        return name.length() == 1 && !Character.isLetterOrDigit(name.charAt(0));
    }
}
