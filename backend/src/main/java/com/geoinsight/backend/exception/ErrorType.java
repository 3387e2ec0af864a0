package com.geoinsight.backend.exception;

/**
 * Error classification recorded for failed subtasks and returned by the API.
 */
public enum ErrorType {
    PARSE_ERROR,
    INVALID_IMAGE,
    NON_CONVERGENCE,
    DIMENSION_MISMATCH,
    PROVIDER_ERROR,
    ORCHESTRATOR_FAULT,
    TIMEOUT,
    CANCELLED,
    INTERNAL_ERROR
}
