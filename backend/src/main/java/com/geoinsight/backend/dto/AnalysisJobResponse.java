package com.geoinsight.backend.dto;

import com.geoinsight.backend.model.AnalysisReport;
import com.geoinsight.backend.model.AnalysisRequest;
import com.geoinsight.backend.model.JobStatus;
import com.geoinsight.backend.model.SubtaskOutcome;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Poll view of an analysis job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Analysis job details")
public class AnalysisJobResponse {

    @Schema(description = "Job ID")
    private String id;

    @Schema(description = "Current job status")
    private JobStatus status;

    @Schema(description = "Submitted request")
    private AnalysisRequest input;

    @Schema(description = "Outcome of each finished subtask, keyed by subtask name")
    private Map<String, SubtaskOutcome> partialResults;

    @Schema(description = "Aggregated report, present only on SUCCESS")
    private AnalysisReport result;

    @Schema(description = "Failure description, present only on FAILURE")
    private String error;

    @Schema(description = "Job creation timestamp")
    private Instant createdAt;

    @Schema(description = "Job start timestamp")
    private Instant startedAt;

    @Schema(description = "Job completion timestamp")
    private Instant completedAt;
}
