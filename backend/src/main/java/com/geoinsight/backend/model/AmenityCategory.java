package com.geoinsight.backend.model;

/**
 * Point-of-interest categories understood by the walk score.
 */
public enum AmenityCategory {
    GROCERY,
    RESTAURANT,
    CAFE,
    SHOPPING,
    SCHOOL,
    HOSPITAL,
    PHARMACY,
    PARK,
    TRANSIT,
    BANK,
    ENTERTAINMENT,
    OTHER
}
