package com.geoinsight.backend.scoring;

/**
 * Newton-Raphson settings for {@link IrrSolver}.
 *
 * @param initialGuess      starting rate
 * @param tolerance         convergence when |NPV(r)| falls below this value, or below the
 *                          rounding floor of the NPV sum when that is larger
 * @param maxIterations     Newton steps allowed before giving up
 * @param derivativeEpsilon derivatives smaller than this in magnitude count as zero
 */
public record IrrSolverConfig(double initialGuess, double tolerance, int maxIterations, double derivativeEpsilon) {

    public IrrSolverConfig {
        if (initialGuess <= -1.0) {
            throw new IllegalArgumentException("initialGuess must be greater than -1");
        }
        if (tolerance <= 0 || derivativeEpsilon <= 0) {
            throw new IllegalArgumentException("tolerance and derivativeEpsilon must be positive");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
    }

    public static IrrSolverConfig defaults() {
        return new IrrSolverConfig(0.1, 1e-6, 100, 1e-12);
    }

    public IrrSolverConfig withInitialGuess(double guess) {
        return new IrrSolverConfig(guess, tolerance, maxIterations, derivativeEpsilon);
    }
}
