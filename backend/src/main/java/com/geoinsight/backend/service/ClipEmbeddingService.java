package com.geoinsight.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.config.SimilarityProperties;
import com.geoinsight.backend.exception.DimensionMismatchException;
import com.geoinsight.backend.exception.ProviderException;
import com.geoinsight.backend.provider.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;

/**
 * Image embeddings from a CLIP inference endpoint.
 *
 * <p>Request {@code {"image": "<base64>", "model": "..."}}, response
 * {@code {"embedding": [...]}}.
 */
@Service
public class ClipEmbeddingService implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(ClipEmbeddingService.class);

    private static final String PROVIDER = "clip";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final int dimension;

    @Value("${clip.api.url:}")
    private String apiUrl;

    @Value("${clip.api.key:}")
    private String apiKey;

    @Value("${clip.api.model:clip-vit-base-patch32}")
    private String model;

    public ClipEmbeddingService(ObjectMapper objectMapper, SimilarityProperties similarityProperties) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.objectMapper = objectMapper;
        this.dimension = similarityProperties.getDimension();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public double[] embed(byte[] image) {
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new ProviderException(PROVIDER, "Embedding endpoint not configured (clip.api.url)");
        }

        try {
            String jsonBody = objectMapper.writeValueAsString(Map.of(
                    "image", Base64.getEncoder().encodeToString(image),
                    "model", model));

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(Duration.ofSeconds(30))
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }

            log.debug("Sending embedding request for {} byte image", image.length);
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.error("CLIP API error: {} - {}", response.statusCode(), response.body());
                throw new ProviderException(PROVIDER, "HTTP " + response.statusCode());
            }

            JsonNode embeddingNode = objectMapper.readTree(response.body()).path("embedding");
            double[] vector = new double[embeddingNode.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = embeddingNode.get(i).asDouble();
            }
            if (vector.length != dimension) {
                throw new DimensionMismatchException(dimension, vector.length);
            }
            return vector;
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, "Interrupted", e);
        }
    }
}
