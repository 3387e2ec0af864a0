package com.geoinsight.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Re-embed stored property photos")
public class BatchEmbedRequest {

    @NotEmpty
    private List<String> propertyIds;

    @Schema(description = "Re-embed properties that are already indexed")
    private boolean force;
}
