package com.geoinsight.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated report of a successful job. Every section the pipeline knows
 * about is present; failed degradable sections are flagged and also listed
 * in {@code missingSections}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {

    private String address;
    private GeoPoint location;
    private Integer radiusMeters;

    @Builder.Default
    private Map<String, ReportSection> sections = new LinkedHashMap<>();

    @Builder.Default
    private List<String> missingSections = new ArrayList<>();

    /**
     * Natural language summary; null when the summarizer failed.
     */
    private String summary;

    private Instant generatedAt;
}
