package com.geoinsight.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.model.AmenityCategory;
import com.geoinsight.backend.model.AmenityRecord;
import com.geoinsight.backend.model.GeoPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OverpassAmenityServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OverpassAmenityService service = new OverpassAmenityService(objectMapper);

    @Test
    void shouldClassifyOsmTags() throws Exception {
        assertThat(OverpassAmenityService.classify(tags("{\"shop\":\"supermarket\"}"))).isEqualTo(AmenityCategory.GROCERY);
        assertThat(OverpassAmenityService.classify(tags("{\"shop\":\"clothes\"}"))).isEqualTo(AmenityCategory.SHOPPING);
        assertThat(OverpassAmenityService.classify(tags("{\"leisure\":\"park\"}"))).isEqualTo(AmenityCategory.PARK);
        assertThat(OverpassAmenityService.classify(tags("{\"highway\":\"bus_stop\"}"))).isEqualTo(AmenityCategory.TRANSIT);
        assertThat(OverpassAmenityService.classify(tags("{\"railway\":\"station\"}"))).isEqualTo(AmenityCategory.TRANSIT);
        assertThat(OverpassAmenityService.classify(tags("{\"amenity\":\"fast_food\"}"))).isEqualTo(AmenityCategory.RESTAURANT);
        assertThat(OverpassAmenityService.classify(tags("{\"amenity\":\"clinic\"}"))).isEqualTo(AmenityCategory.HOSPITAL);
        assertThat(OverpassAmenityService.classify(tags("{\"amenity\":\"atm\"}"))).isEqualTo(AmenityCategory.BANK);
        assertThat(OverpassAmenityService.classify(tags("{\"amenity\":\"parking\"}"))).isEqualTo(AmenityCategory.OTHER);
        assertThat(OverpassAmenityService.classify(tags("{\"name\":\"Untagged\"}"))).isNull();
    }

    @Test
    void shouldParseNodesAndWayCenters() throws Exception {
        // Given a node with coordinates, a park way with a center and an untagged node
        JsonNode root = objectMapper.readTree("""
                {"elements": [
                  {"type": "node", "lat": 18.5214, "lon": 73.8567, "tags": {"amenity": "cafe", "name": "Vohuman"}},
                  {"type": "way", "center": {"lat": 18.5204, "lon": 73.8667}, "tags": {"leisure": "park"}},
                  {"type": "node", "lat": 18.53, "lon": 73.85, "tags": {"name": "Gate"}},
                  {"type": "node", "tags": {"amenity": "bank"}}
                ]}
                """);

        // When
        List<AmenityRecord> amenities = service.parseElements(root, new GeoPoint(18.5204, 73.8567));

        // Then
        assertThat(amenities).hasSize(2);
        assertThat(amenities.get(0).name()).isEqualTo("Vohuman");
        assertThat(amenities.get(0).category()).isEqualTo(AmenityCategory.CAFE);
        assertThat(amenities.get(0).distanceMeters()).isCloseTo(111.2, within(1.0));
        assertThat(amenities.get(1).category()).isEqualTo(AmenityCategory.PARK);
        assertThat(amenities.get(1).name()).isNull();
    }

    @Test
    void shouldBuildAroundQuery() {
        String query = service.buildQuery(new GeoPoint(18.5204, 73.8567), 750);

        assertThat(query).contains("(around:750,18.520400,73.856700)").contains("[leisure=park]").endsWith("out center;");
    }

    @Test
    void shouldMeasureGreatCircleDistance() {
        assertThat(OverpassAmenityService.haversineMeters(0, 0, 0, 1)).isCloseTo(111_195.0, within(5.0));
        assertThat(OverpassAmenityService.haversineMeters(18.52, 73.85, 18.52, 73.85)).isZero();
    }

    private JsonNode tags(String json) throws Exception {
        return objectMapper.readTree(json);
    }
}
