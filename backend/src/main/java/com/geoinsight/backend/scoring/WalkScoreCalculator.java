package com.geoinsight.backend.scoring;

import com.geoinsight.backend.model.AmenityCategory;
import com.geoinsight.backend.model.AmenityRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Amenity-weighted walkability score.
 *
 * <p>Each amenity contributes a distance decay: full credit up to the
 * full-credit distance, falling linearly to nothing at the cutoff. Within a
 * category only the {@code maxCount} closest amenities are counted, and the
 * category earns {@code weight * sum(decay) / maxCount} points, so one category
 * can never contribute more than its weight. The final score is capped at 100.
 *
 * <p>Only the closest amenities are counted, so adding a closer amenity to a
 * category can only raise (or keep) its contribution.
 */
public class WalkScoreCalculator {

    public static final double MAX_SCORE = 100.0;

    public WalkScoreResult score(List<AmenityRecord> amenities, WalkScoreConfig config) {
        Map<AmenityCategory, List<Double>> distances = new EnumMap<>(AmenityCategory.class);
        int total = 0;
        if (amenities != null) {
            for (AmenityRecord amenity : amenities) {
                if (amenity == null || amenity.category() == null) {
                    continue;
                }
                distances.computeIfAbsent(amenity.category(), c -> new ArrayList<>())
                        .add(Math.max(0.0, amenity.distanceMeters()));
                total++;
            }
        }

        List<CategoryScore> breakdown = new ArrayList<>();
        double sum = 0.0;
        for (Map.Entry<AmenityCategory, WalkScoreConfig.CategoryWeight> entry : config.weights().entrySet()) {
            AmenityCategory category = entry.getKey();
            WalkScoreConfig.CategoryWeight weight = entry.getValue();
            List<Double> found = distances.getOrDefault(category, List.of());

            List<Double> closest = found.stream()
                    .sorted(Comparator.naturalOrder())
                    .limit(weight.maxCount())
                    .toList();

            double decaySum = 0.0;
            int counted = 0;
            for (double distance : closest) {
                double decay = decay(distance, config);
                if (decay > 0) {
                    decaySum += decay;
                    counted++;
                }
            }

            double points = weight.weight() * decaySum / weight.maxCount();
            sum += points;
            breakdown.add(new CategoryScore(
                    category,
                    found.size(),
                    counted,
                    closest.isEmpty() ? null : closest.get(0),
                    round(points),
                    weight.weight()));
        }

        if (total == 0) {
            return WalkScoreResult.empty(breakdown);
        }
        return new WalkScoreResult(round(Math.min(MAX_SCORE, sum)), total, breakdown);
    }

    /**
     * Credit in [0, 1] for a single amenity at the given distance.
     */
    public double decay(double distanceMeters, WalkScoreConfig config) {
        double full = config.fullCreditDistanceMeters();
        double cutoff = config.cutoffDistanceMeters();
        if (distanceMeters <= full) {
            return 1.0;
        }
        if (distanceMeters >= cutoff) {
            return 0.0;
        }
        return (cutoff - distanceMeters) / (cutoff - full);
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
