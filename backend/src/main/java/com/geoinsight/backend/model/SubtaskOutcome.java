package com.geoinsight.backend.model;

import com.geoinsight.backend.exception.ErrorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Result-or-error of one subtask, stored under its key in
 * {@link AnalysisJob#getPartialResults()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SubtaskOutcome {

    private SubtaskStatus status;

    /**
     * Subtask output as plain JSON-like values; null when failed.
     */
    private Map<String, Object> data;

    private ErrorType errorType;
    private String error;

    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;

    public static SubtaskOutcome success(Map<String, Object> data, Instant startedAt) {
        Instant now = Instant.now();
        return SubtaskOutcome.builder()
                .status(SubtaskStatus.SUCCESS)
                .data(data)
                .startedAt(startedAt)
                .completedAt(now)
                .durationMs(now.toEpochMilli() - startedAt.toEpochMilli())
                .build();
    }

    public static SubtaskOutcome failure(ErrorType errorType, String error, Instant startedAt) {
        Instant now = Instant.now();
        return SubtaskOutcome.builder()
                .status(SubtaskStatus.FAILED)
                .errorType(errorType)
                .error(error)
                .startedAt(startedAt)
                .completedAt(now)
                .durationMs(now.toEpochMilli() - startedAt.toEpochMilli())
                .build();
    }

    public boolean isSuccess() {
        return status == SubtaskStatus.SUCCESS;
    }
}
