package com.geoinsight.backend.exception;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Analysis job not found: " + jobId);
    }
}
