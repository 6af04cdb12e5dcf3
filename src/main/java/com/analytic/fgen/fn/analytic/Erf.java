package com.analytic.fgen.fn.analytic;

import com.analytic.fgen.fn.Fn1;

/**
 * Error function.
 *
 * Formula:
 * erf(x) = 2/sqrt(pi) * exp(-x^2) * sum_n 2^n x^(2n+1) / (1*3*...*(2n+1))
 *
 * All terms of the series are positive, so it does not lose precision to
 * cancellation. Beyond |x| = 6, erf is within 1e-17 of +/-1.
 */
public final class Erf implements Fn1 {
    public static final Erf INSTANCE = new Erf();

    private static final double TWO_OVER_SQRT_PI = 2.0 / Math.sqrt(Math.PI);
    private static final double SATURATION = 6.0;
    private static final int MAX_TERMS = 500;

    private Erf() {
    }

    @Override
    public double apply(double x) {
        if (Double.isNaN(x))
            return x;
        if (x < 0.0)
            return -apply(-x);
        if (x >= SATURATION)
            return 1.0;

        double x2 = x * x;
        double term = x;
        double sum = x;
        for (int n = 1; n < MAX_TERMS; n++) {
            term *= 2.0 * x2 / (2 * n + 1);
            sum += term;
            if (term <= sum * 1e-17)
                break;
        }
        return TWO_OVER_SQRT_PI * Math.exp(-x2) * sum;
    }
}
