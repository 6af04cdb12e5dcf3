package com.analytic.fgen.fn.analytic;

import com.analytic.fgen.fn.FnN;

/**
 * Smallest of the inputs, scanning left to right.
 *
 * <p>
 * NaN rule: a candidate only replaces the running result when
 * {@code candidate < result}, which is never true when either side is NaN.
 * So a NaN in first position is returned, and a NaN anywhere else is ignored.
 */
public final class Min implements FnN {
    public static final Min INSTANCE = new Min();

    private Min() {
    }

    @Override
    public double apply(double[] inputs) {
        double result = inputs[0];
        for (int i = 1; i < inputs.length; i++) {
            if (inputs[i] < result)
                result = inputs[i];
        }
        return result;
    }
}
