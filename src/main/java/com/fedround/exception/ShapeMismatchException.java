package com.fedround.exception;

/**
 * Aggregation received parameter vectors of different length.
 * This is a configuration bug (workers built with different schemas), never transient,
 * so it is unchecked and fatal for the run.
 */
public class ShapeMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    public ShapeMismatchException(int expected, int actual) {
        super("Parameter vector shape mismatch: expected " + expected + " element(s), got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
