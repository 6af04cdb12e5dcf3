package com.analytic.fgen.util;

import java.util.function.DoubleSupplier;

/**
 * A caller-owned scalar that value leaves can reference.
 *
 * <p>
 * Not synchronised: update it only while no tree that references it is being
 * evaluated.
 */
public final class MutableScalar implements DoubleSupplier {
    private double value;

    public MutableScalar(double initial) {
        this.value = initial;
    }

    public void update(double newValue) {
        this.value = newValue;
    }

    @Override
    public double getAsDouble() {
        return value;
    }
}
