package com.geoinsight.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.exception.ProviderException;
import com.geoinsight.backend.model.AmenityCategory;
import com.geoinsight.backend.model.AmenityRecord;
import com.geoinsight.backend.model.GeoPoint;
import com.geoinsight.backend.provider.AmenityProvider;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Amenities from the OpenStreetMap Overpass API.
 */
@Service
public class OverpassAmenityService implements AmenityProvider {

    private static final Logger log = LoggerFactory.getLogger(OverpassAmenityService.class);

    private static final String PROVIDER = "overpass";
    private static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private static final Set<String> GROCERY_SHOPS = Set.of("supermarket", "convenience", "grocery", "greengrocer", "bakery", "butcher");
    private static final Set<String> TRANSIT_STOPS = Set.of("bus_stop", "station", "halt", "tram_stop", "subway_entrance");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${overpass.api.url:https://overpass-api.de/api/interpreter}")
    private String apiUrl;

    @Value("${geoinsight.http.user-agent:geoinsight-backend/1.0}")
    private String userAgent;

    public OverpassAmenityService(ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<AmenityRecord> fetchAmenities(GeoPoint point, int radiusMeters) {
        String query = buildQuery(point, radiusMeters);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("User-Agent", userAgent)
                .POST(HttpRequest.BodyPublishers.ofString("data=" + URLEncoder.encode(query, StandardCharsets.UTF_8)))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.error("Overpass API error: {} - {}", response.statusCode(), response.body());
                throw new ProviderException(PROVIDER, "HTTP " + response.statusCode());
            }
            List<AmenityRecord> amenities = parseElements(objectMapper.readTree(response.body()), point);
            log.debug("Overpass returned {} amenities within {}m of {}", amenities.size(), radiusMeters, point);
            return amenities;
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, "Interrupted", e);
        }
    }

    String buildQuery(GeoPoint point, int radiusMeters) {
        String around = String.format(Locale.ROOT, "(around:%d,%.6f,%.6f)",
                radiusMeters, point.latitude(), point.longitude());
        return "[out:json][timeout:25];("
                + "node" + around + "[amenity];"
                + "node" + around + "[shop];"
                + "nwr" + around + "[leisure=park];"
                + "node" + around + "[highway=bus_stop];"
                + "node" + around + "[railway~\"station|halt|tram_stop|subway_entrance\"];"
                + ");out center;";
    }

    List<AmenityRecord> parseElements(JsonNode root, GeoPoint origin) {
        List<AmenityRecord> amenities = new ArrayList<>();
        for (JsonNode element : root.path("elements")) {
            JsonNode tags = element.path("tags");
            AmenityCategory category = classify(tags);
            if (category == null) {
                continue;
            }
            JsonNode position = element.has("lat") ? element : element.path("center");
            if (!position.has("lat") || !position.has("lon")) {
                continue;
            }
            double distance = haversineMeters(origin.latitude(), origin.longitude(),
                    position.path("lat").asDouble(), position.path("lon").asDouble());
            String name = tags.hasNonNull("name") ? tags.get("name").asText() : null;
            amenities.add(new AmenityRecord(name, category, distance));
        }
        return amenities;
    }

    /**
     * Maps OpenStreetMap tags to a category; null for tags that are not amenities.
     */
    static AmenityCategory classify(JsonNode tags) {
        String amenity = tags.path("amenity").asText("");
        String shop = tags.path("shop").asText("");
        String leisure = tags.path("leisure").asText("");
        String highway = tags.path("highway").asText("");
        String railway = tags.path("railway").asText("");

        if (GROCERY_SHOPS.contains(shop) || amenity.equals("marketplace")) {
            return AmenityCategory.GROCERY;
        }
        if (!shop.isEmpty()) {
            return AmenityCategory.SHOPPING;
        }
        if (leisure.equals("park")) {
            return AmenityCategory.PARK;
        }
        if (highway.equals("bus_stop") || TRANSIT_STOPS.contains(railway) || amenity.equals("bus_station")) {
            return AmenityCategory.TRANSIT;
        }
        return switch (amenity) {
            case "restaurant", "fast_food", "food_court" -> AmenityCategory.RESTAURANT;
            case "cafe" -> AmenityCategory.CAFE;
            case "school", "kindergarten", "college", "university" -> AmenityCategory.SCHOOL;
            case "hospital", "clinic", "doctors" -> AmenityCategory.HOSPITAL;
            case "pharmacy" -> AmenityCategory.PHARMACY;
            case "bank", "atm" -> AmenityCategory.BANK;
            case "cinema", "theatre", "bar", "pub", "nightclub", "arts_centre" -> AmenityCategory.ENTERTAINMENT;
            case "" -> null;
            default -> AmenityCategory.OTHER;
        };
    }

    static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }
}
