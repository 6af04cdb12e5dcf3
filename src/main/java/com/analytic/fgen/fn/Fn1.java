package com.analytic.fgen.fn;

/**
 * Functional interface for a scalar computation with 1 input.
 *
 * <p>
 * Wrapped by {@link com.analytic.fgen.node.UnaryFunctionNode} so that a single
 * node class serves every one-argument function.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code Math::sin}</li>
 * <li>{@code v -> v > 0.0 ? 1.0 : 0.0}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    /**
     * Applies the function.
     *
     * @param a The input value.
     * @return The result.
     */
    double apply(double a);
}
