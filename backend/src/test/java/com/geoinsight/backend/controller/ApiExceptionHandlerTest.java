package com.geoinsight.backend.controller;

import com.geoinsight.backend.exception.JobAlreadyFinishedException;
import com.geoinsight.backend.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void shouldMapFinishedJobToConflict() {
        ResponseEntity<Map<String, Object>> response =
                handler.conflict(new JobAlreadyFinishedException("job-1", JobStatus.SUCCESS));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).containsEntry("error", "conflict");
        assertThat(response.getBody().get("message").toString()).contains("job-1", "SUCCESS");
    }

    @Test
    void shouldTreatOtherIllegalStateAsInternalError() {
        ResponseEntity<Map<String, Object>> response =
                handler.internal(new IllegalStateException("connection pool shut down"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("error", "internal_error");
    }
}
