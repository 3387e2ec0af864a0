package com.geoinsight.backend.scoring;

/**
 * Converged IRR with the number of Newton steps taken and the residual NPV.
 */
public record IrrResult(double rate, int iterations, double residualNpv) {
}
