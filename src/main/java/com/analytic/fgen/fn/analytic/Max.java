package com.analytic.fgen.fn.analytic;

import com.analytic.fgen.fn.FnN;

/**
 * Largest of the inputs, scanning left to right.
 *
 * <p>
 * Same NaN rule as {@link Min}: NaN in first position wins, NaN anywhere else
 * is ignored.
 */
public final class Max implements FnN {
    public static final Max INSTANCE = new Max();

    private Max() {
    }

    @Override
    public double apply(double[] inputs) {
        double result = inputs[0];
        for (int i = 1; i < inputs.length; i++) {
            if (inputs[i] > result)
                result = inputs[i];
        }
        return result;
    }
}
