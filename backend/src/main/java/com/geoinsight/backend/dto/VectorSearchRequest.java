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
@Schema(description = "Similarity search by raw embedding")
public class VectorSearchRequest {

    @NotEmpty
    @Schema(description = "Query embedding; length must match the index dimension")
    private List<Double> vector;

    @Schema(description = "Minimum similarity (exclusive)", example = "0.7")
    private Double threshold;

    @Schema(description = "Maximum number of matches", example = "5")
    private Integer limit;
}
