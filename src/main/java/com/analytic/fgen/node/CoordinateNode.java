package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;

import java.util.List;
import java.util.Objects;

/**
 * Leaf returning one component of the evaluation context.
 */
public final class CoordinateNode extends AbstractGenerator {

    public enum Axis {
        X, Y, Z, T
    }

    private final Axis axis;

    public CoordinateNode(Axis axis) {
        super(Objects.requireNonNull(axis, "axis").name().toLowerCase(java.util.Locale.ROOT),
                GeneratorType.COORDINATE);
        this.axis = axis;
    }

    public Axis axis() {
        return axis;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new CoordinateNode(axis);
    }

    @Override
    public double generate(Context pos) {
        return switch (axis) {
            case X -> pos.x();
            case Y -> pos.y();
            case Z -> pos.z();
            case T -> pos.t();
        };
    }

    @Override
    public String str() {
        return name();
    }
}
