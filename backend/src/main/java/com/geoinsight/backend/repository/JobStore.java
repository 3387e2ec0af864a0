package com.geoinsight.backend.repository;

import com.geoinsight.backend.model.AnalysisJob;
import com.geoinsight.backend.model.AnalysisReport;
import com.geoinsight.backend.model.SubtaskOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of analysis jobs.
 *
 * <p>Every mutation is a conditional single-record write that applies only
 * while the job is PENDING or RUNNING. Writes to different subtask keys of
 * the same job never overwrite each other, and once a job is terminal every
 * further write is rejected. Mutators return {@code false} when the write was
 * rejected (unknown job or wrong status).
 *
 * <p>Implementations raise {@link com.geoinsight.backend.exception.OrchestratorFaultException}
 * when the underlying storage fails.
 */
public interface JobStore {

    /**
     * Insert a new job. The id, status and creation time must already be set.
     */
    AnalysisJob create(AnalysisJob job);

    Optional<AnalysisJob> findById(String id);

    /**
     * Most recently created jobs first.
     */
    List<AnalysisJob> findRecent(int limit);

    /**
     * PENDING to RUNNING.
     */
    boolean markRunning(String id);

    /**
     * Store the outcome of one subtask under {@code name}.
     */
    boolean recordSubtask(String id, String name, SubtaskOutcome outcome);

    /**
     * Terminal transition to SUCCESS. Returns whether this call made the transition.
     */
    boolean complete(String id, AnalysisReport report);

    /**
     * Terminal transition to FAILURE. Returns whether this call made the transition.
     */
    boolean fail(String id, String error);
}
