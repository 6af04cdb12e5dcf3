package com.analytic.fgen.api;

/**
 * Accepted argument-count range of a node kind, inclusive on both ends.
 */
public record Arity(int min, int max) {

    public Arity {
        if (min < 0 || max < min)
            throw new IllegalArgumentException("Invalid arity range [" + min + ", " + max + "]");
    }

    public static Arity exactly(int n) {
        return new Arity(n, n);
    }

    public static Arity between(int min, int max) {
        return new Arity(min, max);
    }

    public static Arity atLeast(int min) {
        return new Arity(min, Integer.MAX_VALUE);
    }

    /** Any count, including zero. */
    public static Arity any() {
        return new Arity(0, Integer.MAX_VALUE);
    }

    public boolean accepts(int count) {
        return count >= min && count <= max;
    }

    /**
     * @throws ArityException if {@code count} is outside this range.
     */
    public void check(String function, int count) {
        if (!accepts(count))
            throw new ArityException(function, describe(), count, count == 0 && min == 1 && max > 1);
    }

    /** Human-readable form, e.g. "1", "1 or 2", "at least 1". */
    public String describe() {
        if (min == max)
            return Integer.toString(min);
        if (max == Integer.MAX_VALUE)
            return "at least " + min;
        if (max == min + 1)
            return min + " or " + max;
        return "between " + min + " and " + max;
    }
}
