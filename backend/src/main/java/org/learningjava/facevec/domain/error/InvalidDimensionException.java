package org.learningjava.facevec.domain.error;

/**
 * Thrown when a vector's length doesn't match the configured vector size.
 * Raised before any network call is made.
 */
public class InvalidDimensionException extends FacevecException {

    private final int expected;
    private final int actual;

    public InvalidDimensionException(int expected, int actual) {
        super("Vector length mismatch: expected " + expected + ", got " + actual);
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
