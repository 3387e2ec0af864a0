package com.geoinsight.backend.dto;

import com.geoinsight.backend.model.JobStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Accepted analysis job")
public class SubmitAnalysisResponse {

    @Schema(description = "Job ID to poll")
    private String jobId;

    @Schema(description = "Status at submission time, normally PENDING")
    private JobStatus status;
}
