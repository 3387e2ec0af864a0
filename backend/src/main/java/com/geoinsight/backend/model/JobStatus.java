package com.geoinsight.backend.model;

/**
 * Lifecycle of an analysis job. SUCCESS and FAILURE are terminal.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }
}
