package com.geoinsight.backend.model;

/**
 * Kinds of events streamed to clients watching a job.
 */
public enum JobEventType {
    STATUS_CHANGED, // Job moved to RUNNING, SUCCESS or FAILURE
    SUBTASK_COMPLETED // A subtask outcome was merged into the job
}
