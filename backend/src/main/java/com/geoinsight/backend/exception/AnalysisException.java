package com.geoinsight.backend.exception;

/**
 * Base class for the domain errors raised by scoring functions, providers and
 * the orchestrator.
 */
public abstract class AnalysisException extends RuntimeException {

    private final ErrorType errorType;

    protected AnalysisException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected AnalysisException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
