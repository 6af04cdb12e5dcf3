package com.analytic.fgen.api;

/**
 * Closed set of node kinds.
 *
 * <p>
 * Each kind declares the number of arguments its {@code clone} accepts.
 */
public enum GeneratorType {
    VALUE_REF(Arity.any()),
    CONSTANT(Arity.any()),
    COORDINATE(Arity.any()),
    UNARY(Arity.exactly(1)),
    BINARY(Arity.exactly(2)),
    ATAN(Arity.between(1, 2)),
    GAUSSIAN(Arity.between(1, 2)),
    MIN(Arity.atLeast(1)),
    MAX(Arity.atLeast(1)),
    ROUND(Arity.exactly(1)),
    TANH_HAT(Arity.exactly(4)),
    BALLOONING(Arity.exactly(1)),
    MIXMODE(Arity.exactly(1));

    private final Arity arity;

    GeneratorType(Arity arity) {
        this.arity = arity;
    }

    public Arity arity() {
        return arity;
    }
}
