package com.analytic.fgen.fn.analytic;

import com.analytic.fgen.fn.Fn2;

/**
 * Normalised Gaussian of zero mean.
 *
 * Formula:
 * g(x, sigma) = exp(-(x/sigma)^2 / 2) / (sqrt(2 pi) * sigma)
 */
public final class Gaussian implements Fn2 {
    public static final Gaussian INSTANCE = new Gaussian();

    private static final double SQRT_TWO_PI = Math.sqrt(2.0 * Math.PI);

    private Gaussian() {
    }

    @Override
    public double apply(double x, double sigma) {
        double r = x / sigma;
        return Math.exp(-r * r / 2.0) / (SQRT_TWO_PI * sigma);
    }
}
