package com.geoinsight.backend.service;

import com.geoinsight.backend.model.AnalysisReport;
import com.geoinsight.backend.model.AnalysisRequest;
import com.geoinsight.backend.model.GeoPoint;
import com.geoinsight.backend.model.ReportFacts;
import com.geoinsight.backend.model.ReportSection;
import com.geoinsight.backend.model.SectionStatus;
import com.geoinsight.backend.model.SubtaskOutcome;
import com.geoinsight.backend.model.SubtaskType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the final report from subtask outcomes. A section is never
 * silently dropped: it is AVAILABLE, FAILED (and listed as missing) or
 * NOT_REQUESTED.
 */
@Component
public class ReportAggregator {

    private static final List<SubtaskType> SECTIONS = List.of(
            SubtaskType.LOCATION,
            SubtaskType.WALK_SCORE,
            SubtaskType.VEGETATION,
            SubtaskType.INVESTMENT,
            SubtaskType.SIMILARITY);

    public AnalysisReport build(AnalysisRequest request, GeoPoint location, int radiusMeters,
            Map<SubtaskType, SubtaskOutcome> outcomes) {
        Map<String, ReportSection> sections = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();

        for (SubtaskType type : SECTIONS) {
            SubtaskOutcome outcome = outcomes.get(type);
            if (outcome == null) {
                sections.put(type.key(), ReportSection.builder().status(SectionStatus.NOT_REQUESTED).build());
            } else if (outcome.isSuccess()) {
                sections.put(type.key(), ReportSection.builder()
                        .status(SectionStatus.AVAILABLE)
                        .data(outcome.getData())
                        .build());
            } else {
                sections.put(type.key(), failedSection(outcome));
                missing.add(type.key());
            }
        }

        return AnalysisReport.builder()
                .address(request.getAddress())
                .location(location)
                .radiusMeters(radiusMeters)
                .sections(sections)
                .missingSections(missing)
                .generatedAt(Instant.now())
                .build();
    }

    /**
     * What the summarizer is allowed to see: available sections only.
     */
    public ReportFacts facts(AnalysisReport report) {
        Map<String, Map<String, Object>> available = new LinkedHashMap<>();
        report.getSections().forEach((name, section) -> {
            if (section.getStatus() == SectionStatus.AVAILABLE) {
                available.put(name, section.getData());
            }
        });
        return new ReportFacts(report.getAddress(), available, List.copyOf(report.getMissingSections()));
    }

    /**
     * Attach the summary outcome to the report.
     */
    public void applySummary(AnalysisReport report, SubtaskOutcome summary) {
        if (summary.isSuccess()) {
            Object text = summary.getData() != null ? summary.getData().get("text") : null;
            report.setSummary(text != null ? text.toString() : null);
            report.getSections().put(SubtaskType.SUMMARY.key(), ReportSection.builder()
                    .status(SectionStatus.AVAILABLE)
                    .data(summary.getData())
                    .build());
        } else {
            report.getSections().put(SubtaskType.SUMMARY.key(), failedSection(summary));
            report.getMissingSections().add(SubtaskType.SUMMARY.key());
        }
    }

    private static ReportSection failedSection(SubtaskOutcome outcome) {
        return ReportSection.builder()
                .status(SectionStatus.FAILED)
                .errorType(outcome.getErrorType())
                .error(outcome.getError())
                .build();
    }
}
