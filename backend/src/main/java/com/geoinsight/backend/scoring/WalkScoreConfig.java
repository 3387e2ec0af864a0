package com.geoinsight.backend.scoring;

import com.geoinsight.backend.model.AmenityCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tuning for {@link WalkScoreCalculator}.
 *
 * @param weights                  points and counted-amenity cap per category;
 *                                 categories without an entry contribute nothing
 * @param fullCreditDistanceMeters amenities at or below this distance get full credit
 * @param cutoffDistanceMeters     amenities beyond this distance get no credit
 */
public record WalkScoreConfig(Map<AmenityCategory, CategoryWeight> weights,
                              double fullCreditDistanceMeters,
                              double cutoffDistanceMeters) {

    public static final double DEFAULT_FULL_CREDIT_DISTANCE = 400.0;
    public static final double DEFAULT_CUTOFF_DISTANCE = 1600.0;

    public WalkScoreConfig {
        if (fullCreditDistanceMeters < 0 || cutoffDistanceMeters <= fullCreditDistanceMeters) {
            throw new IllegalArgumentException("cutoff distance must exceed full-credit distance");
        }
        EnumMap<AmenityCategory, CategoryWeight> copy = new EnumMap<>(AmenityCategory.class);
        if (weights != null) {
            copy.putAll(weights);
        }
        weights = Collections.unmodifiableMap(copy);
    }

    /**
     * Default weights. They sum to 100 so a saturated neighbourhood scores 100.
     */
    public static WalkScoreConfig defaults() {
        return new WalkScoreConfig(defaultWeights(), DEFAULT_FULL_CREDIT_DISTANCE, DEFAULT_CUTOFF_DISTANCE);
    }

    public static Map<AmenityCategory, CategoryWeight> defaultWeights() {
        Map<AmenityCategory, CategoryWeight> weights = new EnumMap<>(AmenityCategory.class);
        weights.put(AmenityCategory.GROCERY, new CategoryWeight(18, 2));
        weights.put(AmenityCategory.RESTAURANT, new CategoryWeight(12, 3));
        weights.put(AmenityCategory.CAFE, new CategoryWeight(6, 2));
        weights.put(AmenityCategory.SHOPPING, new CategoryWeight(8, 2));
        weights.put(AmenityCategory.SCHOOL, new CategoryWeight(12, 2));
        weights.put(AmenityCategory.HOSPITAL, new CategoryWeight(8, 1));
        weights.put(AmenityCategory.PHARMACY, new CategoryWeight(6, 1));
        weights.put(AmenityCategory.PARK, new CategoryWeight(12, 2));
        weights.put(AmenityCategory.TRANSIT, new CategoryWeight(12, 3));
        weights.put(AmenityCategory.BANK, new CategoryWeight(3, 1));
        weights.put(AmenityCategory.ENTERTAINMENT, new CategoryWeight(3, 2));
        return weights;
    }

    /**
     * @param weight   maximum points the category can contribute
     * @param maxCount number of closest amenities that are counted
     */
    public record CategoryWeight(double weight, int maxCount) {

        public CategoryWeight {
            if (weight < 0) {
                throw new IllegalArgumentException("weight must be non-negative");
            }
            if (maxCount < 1) {
                throw new IllegalArgumentException("maxCount must be at least 1");
            }
        }
    }
}
