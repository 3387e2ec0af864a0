package com.geoinsight.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelAnalysisRequest {

    @Schema(description = "Why the job is cancelled", example = "Address entered incorrectly")
    private String reason;
}
