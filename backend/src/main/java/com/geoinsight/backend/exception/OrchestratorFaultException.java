package com.geoinsight.backend.exception;

/**
 * Internal aggregation or job-record storage failure. The only error that
 * forces a job to FAILURE regardless of subtask criticality.
 */
public class OrchestratorFaultException extends AnalysisException {

    public OrchestratorFaultException(String message, Throwable cause) {
        super(ErrorType.ORCHESTRATOR_FAULT, message, cause);
    }
}
