package com.geoinsight.backend.pubsub;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geoinsight.backend.exception.ErrorType;
import com.geoinsight.backend.model.JobEventType;
import com.geoinsight.backend.model.JobStatus;
import com.geoinsight.backend.model.SubtaskOutcome;
import com.geoinsight.backend.model.SubtaskStatus;

/**
 * Job lifecycle event as carried over Redis Pub/Sub. Status fields are set on
 * {@link JobEventType#STATUS_CHANGED}, subtask fields on
 * {@link JobEventType#SUBTASK_COMPLETED}.
 *
 * @param timestamp epoch milliseconds at which the event was raised
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobEvent(
        String jobId,
        JobEventType type,
        JobStatus status,
        String subtask,
        SubtaskStatus subtaskStatus,
        ErrorType errorType,
        String error,
        Long durationMs,
        long timestamp) {

    public static JobEvent statusChanged(String jobId, JobStatus status, String error) {
        return new JobEvent(jobId, JobEventType.STATUS_CHANGED, status,
                null, null, null, error, null, System.currentTimeMillis());
    }

    public static JobEvent subtaskCompleted(String jobId, String subtask, SubtaskOutcome outcome) {
        return new JobEvent(jobId, JobEventType.SUBTASK_COMPLETED, null,
                subtask, outcome.getStatus(), outcome.getErrorType(), outcome.getError(),
                outcome.getDurationMs(), System.currentTimeMillis());
    }
}
