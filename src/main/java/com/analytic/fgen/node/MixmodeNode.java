package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.fn.analytic.LogisticRandom;

import java.util.List;

/**
 * Mixture of mode numbers with reproducible pseudo-random phases.
 *
 * Formula:
 * f(a) = (1/14) * sum_{i=1..14} cos(i * a + phase[i-1])
 *
 * <p>
 * The 14 phases lie in [-pi, pi) and are drawn once, at construction, from
 * {@link LogisticRandom} starting at {@code seed} and threading each draw's
 * next seed into the following draw. Equal seeds give equal phase tables.
 */
public final class MixmodeNode extends AbstractGenerator {
    public static final int MODES = 14;
    public static final double DEFAULT_SEED = 0.5;

    private final FieldGenerator arg;
    private final double seed;
    private final double[] phase;

    /** Prototype with the default seed. */
    public MixmodeNode() {
        this(null, DEFAULT_SEED);
    }

    public MixmodeNode(FieldGenerator arg, double seed) {
        super("mixmode", GeneratorType.MIXMODE);
        this.arg = arg;
        this.seed = seed;
        this.phase = phases(seed);
    }

    private static double[] phases(double seed) {
        double[] result = new double[MODES];
        double s = seed;
        for (int i = 0; i < MODES; i++) {
            LogisticRandom.Draw draw = LogisticRandom.next(s);
            result[i] = Math.PI * (2.0 * draw.value() - 1.0);
            s = draw.nextSeed();
        }
        return result;
    }

    public double seed() {
        return seed;
    }

    /** Copy of the phase table. */
    public double[] phases() {
        return phase.clone();
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new MixmodeNode(args.get(0), seed);
    }

    @Override
    public double generate(Context pos) {
        double a = arg.generate(pos);
        double result = 0.0;
        for (int i = 1; i <= MODES; i++)
            result += Math.cos(i * a + phase[i - 1]);
        return result / MODES;
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
