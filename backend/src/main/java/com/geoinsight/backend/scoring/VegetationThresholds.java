package com.geoinsight.backend.scoring;

/**
 * HSV classification bounds and the opening kernel size used by
 * {@link VegetationEstimator}. Saturation and value are fractions in [0, 1].
 */
public record VegetationThresholds(double hueMinDegrees,
                                   double hueMaxDegrees,
                                   double minSaturation,
                                   double minValue,
                                   int openingKernelSize) {

    public VegetationThresholds {
        if (hueMinDegrees < 0 || hueMaxDegrees > 360 || hueMinDegrees > hueMaxDegrees) {
            throw new IllegalArgumentException("invalid hue range " + hueMinDegrees + ".." + hueMaxDegrees);
        }
        if (openingKernelSize < 1) {
            throw new IllegalArgumentException("openingKernelSize must be at least 1");
        }
    }

    public static VegetationThresholds defaults() {
        return new VegetationThresholds(60.0, 180.0, 0.08, 0.25, 3);
    }
}
