package com.geoinsight.backend.controller;

import com.geoinsight.backend.dto.AnalysisJobResponse;
import com.geoinsight.backend.dto.CancelAnalysisRequest;
import com.geoinsight.backend.dto.SubmitAnalysisResponse;
import com.geoinsight.backend.model.AnalysisJob;
import com.geoinsight.backend.model.AnalysisRequest;
import com.geoinsight.backend.service.AnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/analyses")
@Tag(name = "Analyses", description = "Asynchronous location analysis jobs")
public class AnalysisController {

    private static final int MAX_LIST_LIMIT = 100;

    private final AnalysisOrchestrator orchestrator;

    public AnalysisController(AnalysisOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    @Operation(summary = "Submit analysis", description = "Queue a location analysis and return its job ID immediately")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job accepted"),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<SubmitAnalysisResponse> submit(@Valid @RequestBody AnalysisRequest request) {
        AnalysisJob job = orchestrator.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitAnalysisResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .build());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Poll analysis", description = "Current status, partial results and, once finished, the report or error")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Job found"),
            @ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<AnalysisJobResponse> getJob(
            @Parameter(description = "Job ID") @PathVariable String id) {

        return ResponseEntity.ok(toResponse(orchestrator.getJob(id)));
    }

    @GetMapping
    @Operation(summary = "List recent analyses", description = "Most recently submitted jobs first")
    public ResponseEntity<List<AnalysisJobResponse>> listJobs(
            @Parameter(description = "Maximum number of jobs") @RequestParam(defaultValue = "20") int limit) {

        int bounded = Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        return ResponseEntity.ok(orchestrator.recentJobs(bounded).stream()
                .map(this::toResponse)
                .toList());
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel analysis", description = "Fail a pending or running job; finished subtasks are kept")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Job cancelled"),
            @ApiResponse(responseCode = "404", description = "Job not found"),
            @ApiResponse(responseCode = "409", description = "Job already finished")
    })
    public ResponseEntity<AnalysisJobResponse> cancel(
            @Parameter(description = "Job ID") @PathVariable String id,
            @RequestBody(required = false) CancelAnalysisRequest request) {

        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(toResponse(orchestrator.cancel(id, reason)));
    }

    private AnalysisJobResponse toResponse(AnalysisJob job) {
        return AnalysisJobResponse.builder()
                .id(job.getId())
                .status(job.getStatus())
                .input(job.getInput())
                .partialResults(job.getPartialResults())
                .result(job.getResult())
                .error(job.getError())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
