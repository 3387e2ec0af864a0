package com.geoinsight.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stored property embedding. {@code sequence} records insertion order so
 * that equal similarity scores rank deterministically.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "property_embeddings")
public class EmbeddingDocument {

    /**
     * Property id.
     */
    @Id
    private String id;

    private List<Double> embedding;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Indexed
    private long sequence;

    private Instant createdAt;
}
