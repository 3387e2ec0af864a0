package com.geoinsight.backend.scoring;

import com.geoinsight.backend.exception.NonConvergenceException;

/**
 * Internal rate of return by Newton-Raphson iteration on the NPV of a
 * periodic cash-flow series, where {@code cashFlows[n]} occurs at period n.
 *
 * <p>The solver never returns a rate it has not verified: every exit other
 * than |NPV| below tolerance raises {@link NonConvergenceException}. Callers
 * may retry with a different initial guess.
 *
 * <p>The tolerance never drops below the rounding error of the NPV sum
 * ({@link #ROUNDING_FLOOR} times the sum of the discounted magnitudes), so a
 * series converges to the same rate whatever currency unit it is expressed in.
 */
public class IrrSolver {

    static final double ROUNDING_FLOOR = 1e-13;

    public IrrResult solve(double[] cashFlows, IrrSolverConfig config) {
        if (cashFlows == null || cashFlows.length < 2) {
            throw new NonConvergenceException("At least two cash flows are required", 0);
        }
        if (!hasSignChange(cashFlows)) {
            throw new NonConvergenceException("Cash flows have no sign change, IRR is undefined", 0);
        }

        double rate = config.initialGuess();
        for (int iteration = 0; iteration <= config.maxIterations(); iteration++) {
            double npv = npv(cashFlows, rate);
            if (!Double.isFinite(npv)) {
                throw new NonConvergenceException("NPV is not finite at rate " + rate, iteration);
            }
            double tolerance = Math.max(config.tolerance(), ROUNDING_FLOOR * discountedMagnitude(cashFlows, rate));
            if (Math.abs(npv) < tolerance) {
                return new IrrResult(rate, iteration, npv);
            }
            if (iteration == config.maxIterations()) {
                break;
            }

            double derivative = npvDerivative(cashFlows, rate);
            if (Math.abs(derivative) < config.derivativeEpsilon()) {
                throw new NonConvergenceException("NPV derivative vanished at rate " + rate, iteration);
            }

            double next = rate - npv / derivative;
            if (!Double.isFinite(next) || next <= -1.0) {
                throw new NonConvergenceException("Iterate left the domain r > -1: " + next, iteration + 1);
            }
            rate = next;
        }
        throw new NonConvergenceException(
                "IRR did not converge within " + config.maxIterations() + " iterations",
                config.maxIterations());
    }

    public double npv(double[] cashFlows, double rate) {
        double npv = 0.0;
        for (int n = 0; n < cashFlows.length; n++) {
            npv += cashFlows[n] / Math.pow(1.0 + rate, n);
        }
        return npv;
    }

    private static double discountedMagnitude(double[] cashFlows, double rate) {
        double sum = 0.0;
        for (int n = 0; n < cashFlows.length; n++) {
            sum += Math.abs(cashFlows[n]) / Math.pow(1.0 + rate, n);
        }
        return sum;
    }

    /**
     * d(NPV)/dr = sum of -n * CF_n / (1 + r)^(n + 1).
     */
    public double npvDerivative(double[] cashFlows, double rate) {
        double derivative = 0.0;
        for (int n = 1; n < cashFlows.length; n++) {
            derivative += -n * cashFlows[n] / Math.pow(1.0 + rate, n + 1);
        }
        return derivative;
    }

    private static boolean hasSignChange(double[] cashFlows) {
        boolean positive = false;
        boolean negative = false;
        for (double cashFlow : cashFlows) {
            if (cashFlow > 0) {
                positive = true;
            } else if (cashFlow < 0) {
                negative = true;
            }
        }
        return positive && negative;
    }
}
