package com.geoinsight.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.config.ScoringProperties;
import com.geoinsight.backend.exception.InputParseException;
import com.geoinsight.backend.model.AmenityRecord;
import com.geoinsight.backend.model.AnalysisRequest;
import com.geoinsight.backend.model.GeoPoint;
import com.geoinsight.backend.model.InvestmentInput;
import com.geoinsight.backend.model.ReportFacts;
import com.geoinsight.backend.model.SimilarityMatch;
import com.geoinsight.backend.provider.AmenityProvider;
import com.geoinsight.backend.provider.AreaImageProvider;
import com.geoinsight.backend.provider.Geocoder;
import com.geoinsight.backend.provider.ReportSummarizer;
import com.geoinsight.backend.scoring.VegetationEstimator;
import com.geoinsight.backend.scoring.VegetationResult;
import com.geoinsight.backend.scoring.WalkScoreCalculator;
import com.geoinsight.backend.scoring.WalkScoreResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The work behind each pipeline subtask. Every method talks to at most one
 * collaborator, feeds the scoring library and returns plain JSON-like data
 * for the job record. Failures surface as exceptions and are recorded by
 * {@link AnalysisOrchestrator}.
 */
@Component
public class AnalysisSubtasks {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Geocoder geocoder;
    private final AmenityProvider amenityProvider;
    private final AreaImageProvider areaImageProvider;
    private final ReportSummarizer reportSummarizer;
    private final WalkScoreCalculator walkScoreCalculator;
    private final VegetationEstimator vegetationEstimator;
    private final InvestmentAnalysisService investmentAnalysisService;
    private final EmbeddingIngestionService embeddingIngestionService;
    private final ScoringProperties scoringProperties;
    private final ObjectMapper objectMapper;

    public AnalysisSubtasks(Geocoder geocoder,
            AmenityProvider amenityProvider,
            AreaImageProvider areaImageProvider,
            ReportSummarizer reportSummarizer,
            WalkScoreCalculator walkScoreCalculator,
            VegetationEstimator vegetationEstimator,
            InvestmentAnalysisService investmentAnalysisService,
            EmbeddingIngestionService embeddingIngestionService,
            ScoringProperties scoringProperties,
            ObjectMapper objectMapper) {
        this.geocoder = geocoder;
        this.amenityProvider = amenityProvider;
        this.areaImageProvider = areaImageProvider;
        this.reportSummarizer = reportSummarizer;
        this.walkScoreCalculator = walkScoreCalculator;
        this.vegetationEstimator = vegetationEstimator;
        this.investmentAnalysisService = investmentAnalysisService;
        this.embeddingIngestionService = embeddingIngestionService;
        this.scoringProperties = scoringProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Coordinates from the request, or from the geocoder when none were given.
     */
    public Map<String, Object> resolveLocation(AnalysisRequest request) {
        GeoPoint point;
        String source;
        if (request.hasCoordinates()) {
            point = new GeoPoint(request.getLatitude(), request.getLongitude());
            source = "request";
        } else {
            point = geocoder.geocode(request.getAddress())
                    .orElseThrow(() -> new InputParseException("Address could not be geocoded: " + request.getAddress()));
            source = "geocoder";
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("latitude", point.latitude());
        data.put("longitude", point.longitude());
        data.put("source", source);
        return data;
    }

    public Map<String, Object> walkScore(GeoPoint point, int radiusMeters) {
        List<AmenityRecord> amenities = amenityProvider.fetchAmenities(point, radiusMeters);
        WalkScoreResult result = walkScoreCalculator.score(amenities, scoringProperties.toWalkScoreConfig());
        return toData(result);
    }

    public Map<String, Object> vegetation(GeoPoint point, int radiusMeters) {
        byte[] image = areaImageProvider.fetchImage(point, radiusMeters);
        VegetationResult result = vegetationEstimator.estimate(image, scoringProperties.toVegetationThresholds());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("coverage", result.coverage());
        data.put("coveragePercent", Math.round(result.coverage() * 1000.0) / 10.0);
        data.put("vegetationPixels", result.vegetationPixels());
        data.put("totalPixels", result.totalPixels());
        data.put("imageWidth", result.mask().getWidth());
        data.put("imageHeight", result.mask().getHeight());
        return data;
    }

    public Map<String, Object> investment(InvestmentInput input) {
        return toData(investmentAnalysisService.analyze(input));
    }

    public Map<String, Object> similarity(String referencePropertyId, int limit) {
        List<SimilarityMatch> matches = embeddingIngestionService.findSimilarToProperty(referencePropertyId, limit);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("referencePropertyId", referencePropertyId);
        data.put("threshold", embeddingIngestionService.resolveThreshold(null));
        data.put("matches", objectMapper.convertValue(matches, new TypeReference<List<Map<String, Object>>>() {
        }));
        return data;
    }

    public Map<String, Object> summary(ReportFacts facts) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("text", reportSummarizer.summarize(facts));
        return data;
    }

    private Map<String, Object> toData(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }
}
