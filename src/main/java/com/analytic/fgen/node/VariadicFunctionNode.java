package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.fn.FnN;
import com.analytic.fgen.fn.analytic.Max;
import com.analytic.fgen.fn.analytic.Min;

import java.util.List;
import java.util.Objects;

/**
 * A generic node that wraps an {@link FnN} over any number of arguments.
 *
 * <p>
 * The input buffer is allocated per evaluation so that a bound tree can be
 * evaluated from several threads at once.
 */
public final class VariadicFunctionNode extends AbstractGenerator {
    private final FnN fn;
    private final List<FieldGenerator> inputs;

    /** Prototype. */
    public VariadicFunctionNode(String name, GeneratorType type, FnN fn) {
        this(name, type, fn, List.of());
    }

    public VariadicFunctionNode(String name, GeneratorType type, FnN fn, List<FieldGenerator> inputs) {
        super(name, type);
        this.fn = Objects.requireNonNull(fn, "fn");
        this.inputs = List.copyOf(inputs);
    }

    /** {@code min(a, ...)}, at least one argument. */
    public static VariadicFunctionNode min() {
        return new VariadicFunctionNode("min", GeneratorType.MIN, Min.INSTANCE);
    }

    /** {@code max(a, ...)}, at least one argument. */
    public static VariadicFunctionNode max() {
        return new VariadicFunctionNode("max", GeneratorType.MAX, Max.INSTANCE);
    }

    @Override
    public List<FieldGenerator> args() {
        return inputs;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new VariadicFunctionNode(name(), type(), fn, args);
    }

    @Override
    public double generate(Context pos) {
        double[] values = new double[inputs.size()];
        for (int i = 0; i < values.length; i++)
            values[i] = inputs.get(i).generate(pos);
        return fn.apply(values);
    }

    @Override
    public String str() {
        return call(name(), inputs.toArray(new FieldGenerator[0]));
    }
}
