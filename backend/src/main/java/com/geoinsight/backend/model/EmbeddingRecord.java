package com.geoinsight.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Property embedding held by the similarity index. Replacing an embedding is
 * a delete followed by an insert.
 *
 * @param propertyId unique property identifier
 * @param vector     fixed-length embedding
 * @param metadata   opaque pass-through attributes (address, price, image url...)
 */
public record EmbeddingRecord(String propertyId, double[] vector, Map<String, Object> metadata) {

    public EmbeddingRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
