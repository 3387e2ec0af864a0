package com.geoinsight.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch embedding report. Every requested id lands in exactly one bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchEmbedResponse {

    @Builder.Default
    private List<String> processed = new ArrayList<>();

    @Builder.Default
    private List<String> skipped = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
