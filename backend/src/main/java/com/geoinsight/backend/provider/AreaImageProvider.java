package com.geoinsight.backend.provider;

import com.geoinsight.backend.model.GeoPoint;

/**
 * Aerial or map imagery of the area around a location.
 */
public interface AreaImageProvider {

    /**
     * Encoded image (PNG or JPEG) covering roughly {@code radiusMeters} around the point.
     */
    byte[] fetchImage(GeoPoint point, int radiusMeters);
}
