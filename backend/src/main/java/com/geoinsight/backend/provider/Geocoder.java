package com.geoinsight.backend.provider;

import com.geoinsight.backend.model.GeoPoint;

import java.util.Optional;

/**
 * Address to coordinate resolution.
 */
public interface Geocoder {

    /**
     * Best match for the address, empty when nothing matches.
     */
    Optional<GeoPoint> geocode(String address);
}
