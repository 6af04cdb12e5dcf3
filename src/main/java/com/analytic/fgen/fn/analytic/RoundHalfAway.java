package com.analytic.fgen.fn.analytic;

import com.analytic.fgen.fn.Fn1;

/**
 * Rounds to the nearest integer, halves away from zero.
 *
 * Formula:
 * y = trunc(x + 0.5) for x >= 0, trunc(x - 0.5) otherwise
 *
 * <p>
 * Not {@link Math#rint(double)} (halves to even) and not
 * {@link Math#round(double)} (halves towards positive infinity):
 * {@code 2.5 -> 3}, {@code -2.5 -> -3}. NaN, infinities and magnitudes of
 * 2^52 or more (always integral) pass through.
 */
public final class RoundHalfAway implements Fn1 {
    public static final RoundHalfAway INSTANCE = new RoundHalfAway();

    private RoundHalfAway() {
    }

    @Override
    public double apply(double a) {
        // Already integral; a + 0.5 is not exact up here.
        if (Double.isNaN(a) || Math.abs(a) >= 0x1p52)
            return a;
        if (a >= 0.0)
            return truncate(a + 0.5);
        return truncate(a - 0.5);
    }

    private static double truncate(double v) {
        return v < 0.0 ? Math.ceil(v) : Math.floor(v);
    }
}
