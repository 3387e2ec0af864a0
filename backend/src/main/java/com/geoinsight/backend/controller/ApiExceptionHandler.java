package com.geoinsight.backend.controller;

import com.geoinsight.backend.exception.AnalysisException;
import com.geoinsight.backend.exception.DimensionMismatchException;
import com.geoinsight.backend.exception.InputParseException;
import com.geoinsight.backend.exception.InvalidImageException;
import com.geoinsight.backend.exception.JobAlreadyFinishedException;
import com.geoinsight.backend.exception.JobNotFoundException;
import com.geoinsight.backend.exception.NonConvergenceException;
import com.geoinsight.backend.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InputParseException.class, DimensionMismatchException.class})
    public ResponseEntity<Map<String, Object>> badInput(AnalysisException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getErrorType().name().toLowerCase(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("validation failed");
        return body(HttpStatus.BAD_REQUEST, "validation_error", msg);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, TypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler({InvalidImageException.class, NonConvergenceException.class})
    public ResponseEntity<Map<String, Object>> unprocessable(AnalysisException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorType().name().toLowerCase(), ex.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(JobNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(JobAlreadyFinishedException.class)
    public ResponseEntity<Map<String, Object>> conflict(JobAlreadyFinishedException ex) {
        return body(HttpStatus.CONFLICT, "conflict", ex.getMessage());
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> badGateway(ProviderException ex) {
        log.warn("Upstream provider failed: {}", ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "provider_error", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> internal(Exception ex) {
        if (ex instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            return body(status, "request_error", ex.getMessage());
        }
        log.error("Unhandled error", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatusCode status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "error", error,
                "message", message == null ? "unexpected error" : message
        ));
    }
}
