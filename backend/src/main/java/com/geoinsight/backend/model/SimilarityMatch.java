package com.geoinsight.backend.model;

import java.util.Map;

/**
 * One ranked hit of a similarity query.
 */
public record SimilarityMatch(String propertyId, double similarity, Map<String, Object> metadata) {
}
