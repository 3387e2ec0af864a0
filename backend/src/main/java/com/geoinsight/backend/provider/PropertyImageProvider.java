package com.geoinsight.backend.provider;

import java.util.Optional;

/**
 * Stored photos of indexed properties.
 */
public interface PropertyImageProvider {

    Optional<byte[]> fetchImage(String propertyId);
}
