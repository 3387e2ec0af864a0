package com.geoinsight.backend.provider;

import com.geoinsight.backend.model.AmenityRecord;
import com.geoinsight.backend.model.GeoPoint;

import java.util.List;

/**
 * Source of points of interest around a location.
 */
public interface AmenityProvider {

    /**
     * Amenities within {@code radiusMeters} of {@code point}, each with its
     * distance from the point.
     *
     * @throws com.geoinsight.backend.exception.ProviderException on any upstream failure
     */
    List<AmenityRecord> fetchAmenities(GeoPoint point, int radiusMeters);
}
