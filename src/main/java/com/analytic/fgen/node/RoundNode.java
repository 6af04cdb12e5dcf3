package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.fn.analytic.RoundHalfAway;

import java.util.List;

/**
 * Round to nearest integer, halves away from zero.
 *
 * @see RoundHalfAway
 */
public final class RoundNode extends AbstractGenerator {
    private final FieldGenerator arg;

    /** Prototype. */
    public RoundNode() {
        this(null);
    }

    public RoundNode(FieldGenerator arg) {
        super("round", GeneratorType.ROUND);
        this.arg = arg;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new RoundNode(args.get(0));
    }

    @Override
    public double generate(Context pos) {
        return RoundHalfAway.INSTANCE.apply(arg.generate(pos));
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
