package com.analytic.fgen.fn.analytic;

/**
 * Stateless pseudo-random number source.
 *
 * <p>
 * {@link #next(double)} is a pure function of its seed: the same seed gives
 * the same draw on every call. To produce a sequence, feed each draw's
 * {@link Draw#nextSeed()} back in as the next seed.
 *
 * <p>
 * The draw iterates the logistic map {@code x -> 3.99 x (1 - x)}, which is
 * chaotic, from a start point in (0, 1) derived from the seed. The number of
 * iterations also depends on the seed.
 */
public final class LogisticRandom {
    private static final double A = 0.01;
    private static final double B = 1.23456789;
    private static final double R = 3.99;

    private LogisticRandom() {
        // Utility class
    }

    /** One draw: a value in (0, 1) and the seed for the following draw. */
    public record Draw(double value, double nextSeed) {
    }

    /**
     * @param seed Any finite value; the sign is ignored.
     * @return The draw for {@code seed}. The next seed is the drawn value.
     */
    public static Draw next(double seed) {
        double value = sample(seed);
        return new Draw(value, value);
    }

    /**
     * @return A value in (0, 1) determined by {@code seed}.
     */
    public static double sample(double seed) {
        if (seed < 0.0)
            seed = -seed;

        int niter = 11 + (int) ((23 + RoundHalfAway.INSTANCE.apply(seed)) % 79);

        double x = (A + seed % B) / (B + 2.0 * A);
        for (int i = 0; i < niter; i++)
            x = R * x * (1.0 - x);
        return x;
    }
}
