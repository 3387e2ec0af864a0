package com.geoinsight.backend.exception;

/**
 * The IRR root finder could not produce a trustworthy root.
 */
public class NonConvergenceException extends AnalysisException {

    private final int iterations;

    public NonConvergenceException(String message, int iterations) {
        super(ErrorType.NON_CONVERGENCE, message);
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }
}
