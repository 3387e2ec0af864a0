package com.geoinsight.backend.exception;

/**
 * Embedding length differs from the index dimensionality.
 */
public class DimensionMismatchException extends AnalysisException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(ErrorType.DIMENSION_MISMATCH,
                "Embedding dimension mismatch: expected " + expected + " but got " + actual);
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
