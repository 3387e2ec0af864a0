package com.geoinsight.backend.service;

import com.geoinsight.backend.exception.ProviderException;
import com.geoinsight.backend.model.GeoPoint;
import com.geoinsight.backend.provider.AreaImageProvider;
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

/**
 * Aerial imagery as a single slippy-map tile. The zoom level is the deepest
 * one whose tile still spans the requested diameter.
 */
@Service
public class MapTileImageService implements AreaImageProvider {

    private static final Logger log = LoggerFactory.getLogger(MapTileImageService.class);

    private static final String PROVIDER = "map-tiles";
    private static final double EARTH_CIRCUMFERENCE_METERS = 40_075_016.686;
    private static final int MIN_ZOOM = 1;
    private static final int MAX_ZOOM = 19;

    private final HttpClient httpClient;

    @Value("${tiles.url-template:https://server.arcgisonline.com/ArcGIS/rest/services/World_Imagery/MapServer/tile/{z}/{y}/{x}}")
    private String urlTemplate;

    @Value("${geoinsight.http.user-agent:geoinsight-backend/1.0}")
    private String userAgent;

    public MapTileImageService() {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public byte[] fetchImage(GeoPoint point, int radiusMeters) {
        int zoom = zoomFor(point.latitude(), radiusMeters);
        int[] tile = tileFor(point, zoom);
        String url = urlTemplate
                .replace("{z}", String.valueOf(zoom))
                .replace("{x}", String.valueOf(tile[0]))
                .replace("{y}", String.valueOf(tile[1]));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(20))
                .header("User-Agent", userAgent)
                .GET()
                .build();

        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                log.error("Tile server error: {} for {}", response.statusCode(), url);
                throw new ProviderException(PROVIDER, "HTTP " + response.statusCode());
            }
            log.debug("Fetched tile z={} x={} y={} ({} bytes)", zoom, tile[0], tile[1], response.body().length);
            return response.body();
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, "Interrupted", e);
        }
    }

    static int zoomFor(double latitude, int radiusMeters) {
        double groundWidth = EARTH_CIRCUMFERENCE_METERS * Math.cos(Math.toRadians(latitude));
        double zoom = Math.floor(Math.log(groundWidth / (2.0 * Math.max(1, radiusMeters))) / Math.log(2));
        return (int) Math.max(MIN_ZOOM, Math.min(MAX_ZOOM, zoom));
    }

    static int[] tileFor(GeoPoint point, int zoom) {
        int tiles = 1 << zoom;
        double latRad = Math.toRadians(point.latitude());
        int x = (int) Math.floor((point.longitude() + 180.0) / 360.0 * tiles);
        int y = (int) Math.floor((1.0 - Math.log(Math.tan(latRad) + 1.0 / Math.cos(latRad)) / Math.PI) / 2.0 * tiles);
        return new int[] {clamp(x, tiles), clamp(y, tiles)};
    }

    private static int clamp(int value, int tiles) {
        return Math.max(0, Math.min(tiles - 1, value));
    }
}
