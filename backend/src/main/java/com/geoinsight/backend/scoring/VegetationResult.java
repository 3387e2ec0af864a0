package com.geoinsight.backend.scoring;

/**
 * Vegetation coverage in [0, 1] together with the mask it was computed from.
 */
public record VegetationResult(double coverage, int vegetationPixels, int totalPixels, VegetationMask mask) {
}
