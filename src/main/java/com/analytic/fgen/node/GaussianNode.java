package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.fn.analytic.Gaussian;

import java.util.List;

/**
 * {@code gauss(x)} or {@code gauss(x, sigma)}; sigma defaults to 1.
 *
 * @see Gaussian
 */
public final class GaussianNode extends AbstractGenerator {
    private final FieldGenerator x;
    private final FieldGenerator sigma;

    /** Prototype. */
    public GaussianNode() {
        this(null, null);
    }

    public GaussianNode(FieldGenerator x, FieldGenerator sigma) {
        super("gauss", GeneratorType.GAUSSIAN);
        this.x = x;
        this.sigma = sigma;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new GaussianNode(args.get(0), args.size() == 2 ? args.get(1) : null);
    }

    @Override
    public double generate(Context pos) {
        double xv = x.generate(pos);
        double s = sigma == null ? 1.0 : sigma.generate(pos);
        return Gaussian.INSTANCE.apply(xv, s);
    }

    @Override
    public List<FieldGenerator> args() {
        return present(x, sigma);
    }

    @Override
    public String str() {
        return sigma == null ? call(name(), x) : call(name(), x, sigma);
    }
}
