package com.geoinsight.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.exception.ProviderException;
import com.geoinsight.backend.model.GeoPoint;
import com.geoinsight.backend.provider.Geocoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Forward geocoding with the OpenStreetMap Nominatim search API.
 */
@Service
public class NominatimGeocodingService implements Geocoder {

    private static final Logger log = LoggerFactory.getLogger(NominatimGeocodingService.class);

    private static final String PROVIDER = "nominatim";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${nominatim.api.url:https://nominatim.openstreetmap.org/search}")
    private String apiUrl;

    @Value("${geoinsight.http.user-agent:geoinsight-backend/1.0}")
    private String userAgent;

    public NominatimGeocodingService(ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<GeoPoint> geocode(String address) {
        String url = apiUrl + "?format=json&limit=1&q=" + URLEncoder.encode(address, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(15))
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.error("Nominatim error: {} - {}", response.statusCode(), response.body());
                throw new ProviderException(PROVIDER, "HTTP " + response.statusCode());
            }

            JsonNode results = objectMapper.readTree(response.body());
            if (!results.isArray() || results.isEmpty()) {
                log.info("No geocoding match for '{}'", address);
                return Optional.empty();
            }
            JsonNode best = results.get(0);
            return Optional.of(new GeoPoint(best.path("lat").asDouble(), best.path("lon").asDouble()));
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, "Interrupted", e);
        }
    }
}
