package io.flowmie.api;

/**
 * Thrown when arrays that must run in parallel have different lengths:
 * S1 against S2, amplitudes against the angle grid, diameters against signals.
 */
public final class DimensionMismatchException extends InvalidInputException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String what, int expected, int actual) {
        super(what + " length mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() { return expected; }

    public int actual() { return actual; }
}
