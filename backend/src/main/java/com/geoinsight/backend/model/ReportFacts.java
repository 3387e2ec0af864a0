package com.geoinsight.backend.model;

import java.util.List;
import java.util.Map;

/**
 * Input of the report summarizer: the successful sections and the names of
 * the ones that are missing.
 */
public record ReportFacts(String address, Map<String, Map<String, Object>> sections, List<String> missingSections) {
}
