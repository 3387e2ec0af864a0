package com.geoinsight.backend.scoring;

import java.util.List;

/**
 * Walk score in [0, 100] with its per-category breakdown.
 */
public record WalkScoreResult(double score, int totalAmenities, List<CategoryScore> breakdown) {

    public static WalkScoreResult empty(List<CategoryScore> breakdown) {
        return new WalkScoreResult(0.0, 0, breakdown);
    }
}
