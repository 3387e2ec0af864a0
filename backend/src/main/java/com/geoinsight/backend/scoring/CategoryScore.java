package com.geoinsight.backend.scoring;

import com.geoinsight.backend.model.AmenityCategory;

/**
 * Walk score contribution of one amenity category.
 */
public record CategoryScore(AmenityCategory category,
                            int found,
                            int counted,
                            Double nearestDistanceMeters,
                            double points,
                            double maxPoints) {
}
