package com.geoinsight.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job document of an asynchronous location analysis.
 *
 * <p>{@code result} is set only on SUCCESS and {@code error} only on FAILURE.
 * A terminal job is never written again.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "analysis_jobs")
public class AnalysisJob {

    @Id
    private String id;

    @Indexed
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    private AnalysisRequest input;

    @Builder.Default
    private Map<String, SubtaskOutcome> partialResults = new LinkedHashMap<>();

    private AnalysisReport result;

    private String error;

    @Indexed
    private Instant createdAt;

    private Instant startedAt;

    // Expired documents are removed by MongoDB
    @Indexed(expireAfter = "30d")
    private Instant completedAt;

    private Instant updatedAt;
}
