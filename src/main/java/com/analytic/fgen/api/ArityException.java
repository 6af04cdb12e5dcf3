package com.analytic.fgen.api;

/**
 * Thrown by {@link FieldGenerator#clone(java.util.List)} when a function is
 * called with a number of arguments its kind does not accept.
 */
public class ArityException extends ParseException {
    private static final long serialVersionUID = 1L;

    private final String function;
    private final String expected;
    private final int actual;

    public ArityException(String function, String expected, int actual) {
        this(function, expected, actual, false);
    }

    ArityException(String function, String expected, int actual, boolean noInputs) {
        super(message(function, expected, actual, noInputs));
        this.function = function;
        this.expected = expected;
        this.actual = actual;
    }

    private static String message(String function, String expected, int actual, boolean noInputs) {
        if (noInputs)
            return function + " function must have some inputs. Expecting " + expected + ", got " + actual;
        return "Incorrect number of arguments to " + function + " function. Expecting " + expected
                + ", got " + actual;
    }

    /** Name the function was called by. */
    public String function() {
        return function;
    }

    /** Accepted count, as text ("1", "1 or 2", "at least 1"). */
    public String expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
