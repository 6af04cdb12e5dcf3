package com.analytic.fgen.node;

import com.analytic.fgen.api.Context;
import com.analytic.fgen.api.FieldGenerator;
import com.analytic.fgen.api.GeneratorType;
import com.analytic.fgen.api.GeometricMetadata;

import java.util.List;

/**
 * Truncated ballooning transform.
 *
 * <p>
 * Makes an expression written in an unrolled poloidal angle approximately
 * periodic in a doubly periodic domain, by summing copies of it shifted by
 * whole periods:
 *
 * <pre>
 * f(x, y, z) = sum_{k=-n..n} arg(x, y + 2 pi k, z - k * shift(x))
 * </pre>
 *
 * where {@code shift(x)} is the periodic angular shift of the surface through
 * {@code x}. On open surfaces, and for {@code n = 0}, the argument is evaluated
 * unshifted.
 *
 * <p>
 * The geometry is a construction parameter, required whenever {@code n > 0}.
 */
public final class BallooningNode extends AbstractGenerator {
    public static final int DEFAULT_COPIES = 3;

    private static final double TWO_PI = 2.0 * Math.PI;

    private final GeometricMetadata metadata;
    private final FieldGenerator arg;
    private final int ballN; // How many times around in each direction

    /** Prototype with the default number of copies. */
    public BallooningNode(GeometricMetadata metadata) {
        this(metadata, null, DEFAULT_COPIES);
    }

    public BallooningNode(GeometricMetadata metadata, FieldGenerator arg, int ballN) {
        super("ballooning", GeneratorType.BALLOONING);
        if (ballN < 0)
            throw new IllegalArgumentException("ballooning copy count must be >= 0, got " + ballN);
        if (metadata == null && ballN > 0)
            throw new IllegalArgumentException("ballooning function needs geometric metadata");
        this.metadata = metadata;
        this.arg = arg;
        this.ballN = ballN;
    }

    public int copies() {
        return ballN;
    }

    @Override
    protected FieldGenerator bind(List<FieldGenerator> args) {
        return new BallooningNode(metadata, args.get(0), ballN);
    }

    @Override
    public double generate(Context pos) {
        if (ballN == 0)
            return arg.generate(pos);

        if (!metadata.isPeriodicY(pos.x()))
            return arg.generate(pos);

        double shift = metadata.periodicShiftAt(pos.x());
        double value = 0.0;
        for (int k = -ballN; k <= ballN; k++) {
            if (k == 0) {
                value += arg.generate(pos);
            } else {
                value += arg.generate(new Context(pos.x(), pos.y() + k * TWO_PI, pos.z() - k * shift,
                        pos.t(), pos.metadata()));
            }
        }
        return value;
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
