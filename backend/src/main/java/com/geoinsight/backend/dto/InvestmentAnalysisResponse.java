package com.geoinsight.backend.dto;

import com.geoinsight.backend.scoring.DealQuality;
import com.geoinsight.backend.scoring.InvestmentMetrics;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Investment metrics with a debt coverage rating and deal grade")
public class InvestmentAnalysisResponse {

    private InvestmentMetrics metrics;

    @Schema(description = "Excellent, Good, Marginal, Risky or N/A (no loan)")
    private String dscrRating;

    @Schema(description = "Overall grade from cash-on-cash return, DSCR and cash flow")
    private DealQuality quality;

    @Schema(description = "STRONG BUY, BUY, HOLD / NEGOTIATE, AVOID / RENEGOTIATE or AVOID")
    private String recommendation;

    @Schema(description = "One-line reason for the recommendation")
    private String rationale;

    @Schema(description = "Initial guess from which the IRR converged")
    private double irrInitialGuess;
}
