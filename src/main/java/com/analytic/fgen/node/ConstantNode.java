package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;

import java.util.List;

/**
 * Leaf holding a literal number.
 */
public final class ConstantNode extends AbstractGenerator {
    private final double value;

    public ConstantNode(double value) {
        this(Double.toString(value), value);
    }

    /** Named constant, e.g. {@code pi}. */
    public ConstantNode(String name, double value) {
        super(name, GeneratorType.CONSTANT);
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new ConstantNode(name(), value);
    }

    @Override
    public double generate(Context pos) {
        return value;
    }

    @Override
    public String str() {
        return name();
    }
}
