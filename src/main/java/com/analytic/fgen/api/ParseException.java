package com.analytic.fgen.api;

/**
 * A malformed expression: unknown function, unresolved reference, or a bad
 * argument list. Always fatal for the expression being built.
 */
public class ParseException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
