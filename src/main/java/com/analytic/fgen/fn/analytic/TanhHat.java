package com.analytic.fgen.fn.analytic;

import com.analytic.fgen.fn.FnN;

/**
 * Smoothed top-hat profile.
 *
 * Inputs: {@code [x, width, center, steepness]}.
 *
 * Formula:
 * y = 0.5 * (tanh(s * (x - (c - w/2))) - tanh(s * (x - (c + w/2))))
 *
 * Close to 1 inside [c - w/2, c + w/2], close to 0 outside, with edges whose
 * sharpness grows with {@code s}.
 */
public final class TanhHat implements FnN {
    public static final TanhHat INSTANCE = new TanhHat();

    private TanhHat() {
    }

    @Override
    public double apply(double[] inputs) {
        return apply(inputs[0], inputs[1], inputs[2], inputs[3]);
    }

    public double apply(double x, double width, double center, double steepness) {
        return 0.5 * (Math.tanh(steepness * (x - (center - 0.5 * width)))
                - Math.tanh(steepness * (x - (center + 0.5 * width))));
    }
}
