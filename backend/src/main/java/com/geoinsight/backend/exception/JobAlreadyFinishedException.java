package com.geoinsight.backend.exception;

import com.geoinsight.backend.model.JobStatus;

/**
 * Raised when a job that already reached SUCCESS or FAILURE is asked to change state.
 */
public class JobAlreadyFinishedException extends RuntimeException {

    private final String jobId;
    private final JobStatus status;

    public JobAlreadyFinishedException(String jobId, JobStatus status) {
        super("Job " + jobId + " already finished with status " + status);
        this.jobId = jobId;
        this.status = status;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }
}
