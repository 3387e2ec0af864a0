package com.geoinsight.backend.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of an analysis submission. Stored unchanged as the job input.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Location analysis request")
public class AnalysisRequest {

    @NotBlank
    @Schema(description = "Address to analyze", example = "Koramangala, Bengaluru")
    private String address;

    @DecimalMin("-90") @DecimalMax("90")
    @Schema(description = "Latitude; skips geocoding when given with longitude")
    private Double latitude;

    @DecimalMin("-180") @DecimalMax("180")
    private Double longitude;

    @Min(100) @Max(5000)
    @Schema(description = "Amenity search radius in meters", example = "1000")
    private Integer radiusMeters;

    @Valid
    private InvestmentInput investment;

    @Schema(description = "Indexed property whose photo is compared against the index")
    private String referencePropertyId;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
