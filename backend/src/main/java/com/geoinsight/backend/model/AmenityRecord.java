package com.geoinsight.backend.model;

/**
 * A point of interest returned by the amenity provider.
 *
 * @param name           display name, may be null
 * @param category       normalized category
 * @param distanceMeters distance from the query point
 */
public record AmenityRecord(String name, AmenityCategory category, double distanceMeters) {
}
