package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;

import java.util.List;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Leaf that reads an externally owned scalar on every evaluation.
 *
 * <p>
 * The node does not own the scalar. Whoever supplied it keeps it alive for as
 * long as the node is in use; changing it between evaluations changes the
 * result ("live" expressions). Changing it while another thread evaluates the
 * tree is the caller's problem.
 */
public final class ValueRefNode extends AbstractGenerator {
    private final DoubleSupplier ref;

    public ValueRefNode(String name, DoubleSupplier ref) {
        super(name, GeneratorType.VALUE_REF);
        this.ref = Objects.requireNonNull(ref, "ref");
    }

    /** Ignores {@code args}; the new node reads the same scalar. */
    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new ValueRefNode(name(), ref);
    }

    @Override
    public double generate(Context pos) {
        return ref.getAsDouble();
    }

    @Override
    public String str() {
        return name();
    }
}
