package com.geoinsight.backend.service;

import com.geoinsight.backend.config.SimilarityProperties;
import com.geoinsight.backend.dto.BatchEmbedResponse;
import com.geoinsight.backend.exception.AnalysisException;
import com.geoinsight.backend.exception.InvalidImageException;
import com.geoinsight.backend.exception.ProviderException;
import com.geoinsight.backend.model.EmbeddingRecord;
import com.geoinsight.backend.model.SimilarityMatch;
import com.geoinsight.backend.provider.EmbeddingModel;
import com.geoinsight.backend.provider.PropertyImageProvider;
import com.geoinsight.backend.repository.SimilarityIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the similarity index in step with stored property photos and runs
 * similarity queries against it.
 */
@Service
public class EmbeddingIngestionService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingIngestionService.class);

    private final SimilarityIndex similarityIndex;
    private final EmbeddingModel embeddingModel;
    private final PropertyImageProvider propertyImageProvider;
    private final FileStorageService fileStorageService;
    private final SimilarityProperties similarityProperties;

    public EmbeddingIngestionService(SimilarityIndex similarityIndex,
            EmbeddingModel embeddingModel,
            PropertyImageProvider propertyImageProvider,
            FileStorageService fileStorageService,
            SimilarityProperties similarityProperties) {
        this.similarityIndex = similarityIndex;
        this.embeddingModel = embeddingModel;
        this.propertyImageProvider = propertyImageProvider;
        this.fileStorageService = fileStorageService;
        this.similarityProperties = similarityProperties;
    }

    /**
     * Store a property photo, embed it and index the embedding.
     */
    public EmbeddingRecord ingestPhoto(String propertyId, byte[] image, String filename, String contentType,
            Map<String, Object> metadata) {
        if (image == null || image.length == 0) {
            throw new InvalidImageException("Photo is empty");
        }
        String fileId = fileStorageService.storePhoto(propertyId, image, filename, contentType);

        Map<String, Object> enriched = new LinkedHashMap<>();
        if (metadata != null) {
            enriched.putAll(metadata);
        }
        enriched.put("photoFileId", fileId);
        enriched.put("imageUrl", fileStorageService.getPhotoUrl(propertyId));

        EmbeddingRecord record = new EmbeddingRecord(propertyId, embeddingModel.embed(image), enriched);
        similarityIndex.upsert(record);
        log.info("[INDEX] Ingested photo for property {}", propertyId);
        return record;
    }

    /**
     * Re-embed the stored photos of the given properties.
     *
     * @param force re-embed properties that are already indexed
     */
    public BatchEmbedResponse batchEmbed(List<String> propertyIds, boolean force) {
        BatchEmbedResponse response = BatchEmbedResponse.builder().build();
        for (String propertyId : propertyIds) {
            Optional<EmbeddingRecord> existing = similarityIndex.find(propertyId);
            if (existing.isPresent() && !force) {
                response.getSkipped().add(propertyId);
                continue;
            }
            try {
                byte[] photo = propertyImageProvider.fetchImage(propertyId)
                        .orElseThrow(() -> new ProviderException("property-images",
                                "No photo stored for property " + propertyId));
                Map<String, Object> metadata = existing.map(EmbeddingRecord::metadata).orElse(Map.of());
                similarityIndex.upsert(new EmbeddingRecord(propertyId, embeddingModel.embed(photo), metadata));
                response.getProcessed().add(propertyId);
            } catch (AnalysisException e) {
                log.warn("[INDEX] Could not embed property {}: {}", propertyId, e.getMessage());
                response.getErrors().add(propertyId + ": " + e.getMessage());
            }
        }
        log.info("[INDEX] Batch embed finished: {} processed, {} skipped, {} errors",
                response.getProcessed().size(), response.getSkipped().size(), response.getErrors().size());
        return response;
    }

    public List<SimilarityMatch> searchByImage(byte[] image, Double threshold, Integer limit) {
        if (image == null || image.length == 0) {
            throw new InvalidImageException("Query image is empty");
        }
        return searchByVector(embeddingModel.embed(image), threshold, limit);
    }

    public List<SimilarityMatch> searchByVector(double[] vector, Double threshold, Integer limit) {
        return similarityIndex.search(vector, resolveThreshold(threshold), similarityProperties.resolveLimit(limit));
    }

    /**
     * Properties that look like the given one, excluding itself. Uses the
     * indexed embedding when present, otherwise embeds the stored photo.
     */
    public List<SimilarityMatch> findSimilarToProperty(String propertyId, int limit) {
        double[] vector = similarityIndex.find(propertyId)
                .map(EmbeddingRecord::vector)
                .orElseGet(() -> embeddingModel.embed(propertyImageProvider.fetchImage(propertyId)
                        .orElseThrow(() -> new ProviderException("property-images",
                                "No photo stored for property " + propertyId))));

        return similarityIndex.search(vector, similarityProperties.getThreshold(), limit + 1).stream()
                .filter(match -> !match.propertyId().equals(propertyId))
                .limit(limit)
                .toList();
    }

    public Optional<EmbeddingRecord> find(String propertyId) {
        return similarityIndex.find(propertyId);
    }

    /**
     * Remove a property from the index together with its photo.
     */
    public boolean delete(String propertyId) {
        boolean removed = similarityIndex.delete(propertyId);
        boolean photoRemoved = fileStorageService.deletePhoto(propertyId);
        return removed || photoRemoved;
    }

    public long size() {
        return similarityIndex.size();
    }

    public int dimension() {
        return similarityIndex.dimension();
    }

    public double resolveThreshold(Double threshold) {
        return threshold != null ? threshold : similarityProperties.getThreshold();
    }
}
