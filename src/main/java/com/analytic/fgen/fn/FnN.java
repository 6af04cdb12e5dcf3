package com.analytic.fgen.fn;

/**
 * Functional interface for a scalar computation with N inputs.
 *
 * The input array is owned by the caller and only valid for the duration of the
 * call. Implementations must not capture or modify it.
 */
@FunctionalInterface
public interface FnN {
    /**
     * Computes a result from an array of inputs.
     *
     * @param inputs The input values (read-only, transient).
     * @return The result.
     */
    double apply(double[] inputs);
}
