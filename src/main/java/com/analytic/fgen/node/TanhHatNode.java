package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.fn.analytic.TanhHat;

import java.util.List;

/**
 * {@code tanhhat(x, width, center, steepness)}.
 *
 * @see TanhHat
 */
public final class TanhHatNode extends AbstractGenerator {
    private final FieldGenerator x;
    private final FieldGenerator width;
    private final FieldGenerator center;
    private final FieldGenerator steepness;

    /** Prototype. */
    public TanhHatNode() {
        this(null, null, null, null);
    }

    public TanhHatNode(FieldGenerator x, FieldGenerator width, FieldGenerator center,
            FieldGenerator steepness) {
        super("tanhhat", GeneratorType.TANH_HAT);
        this.x = x;
        this.width = width;
        this.center = center;
        this.steepness = steepness;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new TanhHatNode(args.get(0), args.get(1), args.get(2), args.get(3));
    }

    @Override
    public double generate(Context pos) {
        double xv = x.generate(pos);
        double w = width.generate(pos);
        double c = center.generate(pos);
        double s = steepness.generate(pos);
        return TanhHat.INSTANCE.apply(xv, w, c, s);
    }

    @Override
    public List<FieldGenerator> args() {
        return present(x, width, center, steepness);
    }

    @Override
    public String str() {
        return call(name(), x, width, center, steepness);
    }
}
