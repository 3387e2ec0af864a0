package com.geoinsight.backend.provider;

import com.geoinsight.backend.model.ReportFacts;

/**
 * Turns report facts into a short narrative.
 */
public interface ReportSummarizer {

    String summarize(ReportFacts facts);
}
