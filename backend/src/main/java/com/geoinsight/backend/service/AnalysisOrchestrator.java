package com.geoinsight.backend.service;

import com.geoinsight.backend.config.AsyncConfig;
import com.geoinsight.backend.config.OrchestratorProperties;
import com.geoinsight.backend.exception.AnalysisException;
import com.geoinsight.backend.exception.ErrorType;
import com.geoinsight.backend.exception.JobAlreadyFinishedException;
import com.geoinsight.backend.exception.JobNotFoundException;
import com.geoinsight.backend.exception.OrchestratorFaultException;
import com.geoinsight.backend.model.AnalysisJob;
import com.geoinsight.backend.model.AnalysisReport;
import com.geoinsight.backend.model.AnalysisRequest;
import com.geoinsight.backend.model.GeoPoint;
import com.geoinsight.backend.model.JobStatus;
import com.geoinsight.backend.model.SubtaskOutcome;
import com.geoinsight.backend.model.SubtaskType;
import com.geoinsight.backend.pubsub.JobEventPublisher;
import com.geoinsight.backend.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs analysis jobs: PENDING, then RUNNING while subtasks execute, then
 * exactly one terminal transition.
 *
 * <p>The {@code location} subtask runs first. The remaining subtasks fan out
 * on the subtask pool, each under its own timeout, and each outcome is merged
 * into the job record as soon as it is known. Merges go through the
 * {@link JobStore}'s conditional writes, so nothing is locked while providers
 * are working and a cancelled job ignores late results. Once every
 * dispatched subtask has finished, a single aggregation pass builds the
 * report, asks for a summary and completes the job.
 */
@Service
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final JobStore jobStore;
    private final AnalysisSubtasks subtasks;
    private final ReportAggregator reportAggregator;
    private final JobEventPublisher eventPublisher;
    private final OrchestratorProperties properties;
    private final TaskExecutor coordinatorExecutor;
    private final Executor subtaskExecutor;

    public AnalysisOrchestrator(JobStore jobStore,
            AnalysisSubtasks subtasks,
            ReportAggregator reportAggregator,
            JobEventPublisher eventPublisher,
            OrchestratorProperties properties,
            @Qualifier(AsyncConfig.COORDINATOR_EXECUTOR) TaskExecutor coordinatorExecutor,
            @Qualifier(AsyncConfig.SUBTASK_EXECUTOR) Executor subtaskExecutor) {
        this.jobStore = jobStore;
        this.subtasks = subtasks;
        this.reportAggregator = reportAggregator;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.coordinatorExecutor = coordinatorExecutor;
        this.subtaskExecutor = subtaskExecutor;
    }

    /**
     * Create a new analysis job and schedule it. Returns without waiting for
     * any subtask.
     */
    public AnalysisJob submit(AnalysisRequest request) {
        Instant now = Instant.now();
        AnalysisJob job = AnalysisJob.builder()
                .id(UUID.randomUUID().toString())
                .status(JobStatus.PENDING)
                .input(request)
                .createdAt(now)
                .build();
        jobStore.create(job);
        log.info("[ANALYSIS] Accepted job {} for '{}'", job.getId(), request.getAddress());
        publishStatus(job.getId(), JobStatus.PENDING, null);

        try {
            coordinatorExecutor.execute(() -> run(job.getId()));
        } catch (TaskRejectedException e) {
            log.error("[ANALYSIS] Worker pool rejected job {}", job.getId(), e);
            forceFail(job.getId(), "Rejected: analysis workers are saturated");
            return jobStore.findById(job.getId()).orElse(job);
        }
        return job;
    }

    public AnalysisJob getJob(String jobId) {
        return jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<AnalysisJob> recentJobs(int limit) {
        return jobStore.findRecent(limit);
    }

    /**
     * Fail a job that has not finished yet. Results already merged are kept;
     * subtasks still running are ignored when they complete.
     *
     * @throws JobAlreadyFinishedException when the job is already terminal
     */
    public AnalysisJob cancel(String jobId, String reason) {
        AnalysisJob job = getJob(jobId);
        if (job.getStatus().isTerminal()) {
            throw new JobAlreadyFinishedException(jobId, job.getStatus());
        }
        String error = "Cancelled: " + (reason == null || reason.isBlank() ? "no reason given" : reason.trim());
        if (!jobStore.fail(jobId, error)) {
            throw new JobAlreadyFinishedException(jobId, getJob(jobId).getStatus());
        }
        log.info("[ANALYSIS] Job {} cancelled: {}", jobId, error);
        publishStatus(jobId, JobStatus.FAILURE, error);
        return getJob(jobId);
    }

    /**
     * Run a stored job to completion on the calling thread. Never throws.
     */
    void run(String jobId) {
        try {
            execute(jobId);
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            String message = cause instanceof OrchestratorFaultException
                    ? cause.getMessage()
                    : "Aggregation failed: " + cause.getMessage();
            log.error("[ANALYSIS] Job {} aborted by internal fault", jobId, cause);
            forceFail(jobId, "Internal error: " + message);
        }
    }

    private void execute(String jobId) {
        AnalysisJob job = jobStore.findById(jobId)
                .orElseThrow(() -> new OrchestratorFaultException("Job " + jobId + " vanished before execution", null));
        if (!jobStore.markRunning(jobId)) {
            log.info("[ANALYSIS] Job {} is no longer pending, skipping", jobId);
            return;
        }
        publishStatus(jobId, JobStatus.RUNNING, null);

        AnalysisRequest request = job.getInput();
        int radius = request.getRadiusMeters() != null ? request.getRadiusMeters() : properties.getDefaultRadiusMeters();
        OrchestratorProperties.Timeouts timeouts = properties.getTimeouts();
        Map<SubtaskType, SubtaskOutcome> outcomes = new EnumMap<>(SubtaskType.class);

        SubtaskOutcome location = dispatch(jobId, SubtaskType.LOCATION, timeouts.getLocation(),
                () -> subtasks.resolveLocation(request)).join();
        outcomes.put(SubtaskType.LOCATION, location);
        if (!location.isSuccess()) {
            failCritical(jobId, SubtaskType.LOCATION, location);
            return;
        }
        GeoPoint point = new GeoPoint(
                ((Number) location.getData().get("latitude")).doubleValue(),
                ((Number) location.getData().get("longitude")).doubleValue());

        Map<SubtaskType, CompletableFuture<SubtaskOutcome>> pending = new EnumMap<>(SubtaskType.class);
        pending.put(SubtaskType.WALK_SCORE, dispatch(jobId, SubtaskType.WALK_SCORE, timeouts.getWalkScore(),
                () -> subtasks.walkScore(point, radius)));
        pending.put(SubtaskType.VEGETATION, dispatch(jobId, SubtaskType.VEGETATION, timeouts.getVegetation(),
                () -> subtasks.vegetation(point, radius)));
        if (request.getInvestment() != null) {
            pending.put(SubtaskType.INVESTMENT, dispatch(jobId, SubtaskType.INVESTMENT, timeouts.getInvestment(),
                    () -> subtasks.investment(request.getInvestment())));
        }
        if (request.getReferencePropertyId() != null && !request.getReferencePropertyId().isBlank()) {
            pending.put(SubtaskType.SIMILARITY, dispatch(jobId, SubtaskType.SIMILARITY, timeouts.getSimilarity(),
                    () -> subtasks.similarity(request.getReferencePropertyId(), properties.getSimilarityLimit())));
        }

        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();
        pending.forEach((type, future) -> outcomes.put(type, future.join()));

        aggregate(jobId, request, point, radius, outcomes);
    }

    private void aggregate(String jobId, AnalysisRequest request, GeoPoint point, int radius,
            Map<SubtaskType, SubtaskOutcome> outcomes) {
        if (isTerminal(jobId)) {
            log.info("[ANALYSIS] Job {} finished while subtasks were running, skipping aggregation", jobId);
            return;
        }

        for (Map.Entry<SubtaskType, SubtaskOutcome> entry : outcomes.entrySet()) {
            if (entry.getKey().isCritical() && !entry.getValue().isSuccess()) {
                failCritical(jobId, entry.getKey(), entry.getValue());
                return;
            }
        }

        AnalysisReport report = reportAggregator.build(request, point, radius, outcomes);
        SubtaskOutcome summary = dispatch(jobId, SubtaskType.SUMMARY, properties.getTimeouts().getSummary(),
                () -> subtasks.summary(reportAggregator.facts(report))).join();
        reportAggregator.applySummary(report, summary);

        if (jobStore.complete(jobId, report)) {
            log.info("[ANALYSIS] Job {} succeeded, missing sections: {}", jobId, report.getMissingSections());
            publishStatus(jobId, JobStatus.SUCCESS, null);
        } else {
            log.info("[ANALYSIS] Job {} was finished elsewhere, report discarded", jobId);
        }
    }

    /**
     * Start a subtask on the subtask pool. The returned future completes
     * normally with the merged outcome, or exceptionally only when the merge
     * itself failed.
     */
    private CompletableFuture<SubtaskOutcome> dispatch(String jobId, SubtaskType type, Duration timeout,
            Supplier<Map<String, Object>> work) {
        Instant startedAt = Instant.now();
        log.debug("[SUBTASK] Dispatching {} for job {}", type.key(), jobId);

        CompletableFuture<Map<String, Object>> future;
        try {
            future = CompletableFuture.supplyAsync(work, subtaskExecutor);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((data, error) -> error == null
                        ? SubtaskOutcome.success(data, startedAt)
                        : toFailure(jobId, type, timeout, error, startedAt))
                .thenApply(outcome -> merge(jobId, type, outcome));
    }

    private SubtaskOutcome toFailure(String jobId, SubtaskType type, Duration timeout, Throwable error,
            Instant startedAt) {
        Throwable cause = unwrap(error);
        ErrorType errorType;
        String message;
        if (cause instanceof TimeoutException) {
            errorType = ErrorType.TIMEOUT;
            message = "Timed out after " + timeout.toMillis() + " ms";
        } else if (cause instanceof AnalysisException) {
            errorType = ((AnalysisException) cause).getErrorType();
            message = cause.getMessage();
        } else {
            errorType = ErrorType.INTERNAL_ERROR;
            message = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }

        if (type.isCritical()) {
            log.error("[SUBTASK] Critical {} failed for job {}: {} {}", type.key(), jobId, errorType, message);
        } else {
            log.warn("[SUBTASK] {} failed for job {}, section degraded: {} {}", type.key(), jobId, errorType, message);
        }
        if (errorType == ErrorType.INTERNAL_ERROR) {
            log.error("[SUBTASK] Unexpected exception in {} for job {}", type.key(), jobId, cause);
        }
        return SubtaskOutcome.failure(errorType, message, startedAt);
    }

    private SubtaskOutcome merge(String jobId, SubtaskType type, SubtaskOutcome outcome) {
        if (jobStore.recordSubtask(jobId, type.key(), outcome)) {
            log.info("[SUBTASK] {} {} for job {} in {} ms", type.key(), outcome.getStatus(), jobId, outcome.getDurationMs());
            eventPublisher.publishSubtaskCompleted(jobId, type.key(), outcome);
        } else {
            log.info("[SUBTASK] Discarded {} result for job {}: job already finished", type.key(), jobId);
        }
        return outcome;
    }

    private void failCritical(String jobId, SubtaskType type, SubtaskOutcome outcome) {
        String error = "Critical subtask '" + type.key() + "' failed (" + outcome.getErrorType() + "): "
                + outcome.getError();
        if (jobStore.fail(jobId, error)) {
            log.warn("[ANALYSIS] Job {} failed: {}", jobId, error);
            publishStatus(jobId, JobStatus.FAILURE, error);
        }
    }

    private void forceFail(String jobId, String error) {
        try {
            if (jobStore.fail(jobId, error)) {
                publishStatus(jobId, JobStatus.FAILURE, error);
            }
        } catch (RuntimeException e) {
            log.error("[ANALYSIS] Could not record failure of job {}", jobId, e);
        }
    }

    private boolean isTerminal(String jobId) {
        return jobStore.findById(jobId).map(job -> job.getStatus().isTerminal()).orElse(true);
    }

    private void publishStatus(String jobId, JobStatus status, String error) {
        eventPublisher.publishStatusChange(jobId, status, error);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
