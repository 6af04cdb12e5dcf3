package com.analytic.fgen.fn.analytic;

import com.analytic.fgen.fn.Fn1;

/**
 * Step function: 1 for strictly positive input, 0 otherwise (including 0 and NaN).
 */
public final class Heaviside implements Fn1 {
    public static final Heaviside INSTANCE = new Heaviside();

    private Heaviside() {
    }

    @Override
    public double apply(double a) {
        return a > 0.0 ? 1.0 : 0.0;
    }
}
