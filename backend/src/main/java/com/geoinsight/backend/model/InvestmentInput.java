package com.geoinsight.backend.model;

import com.geoinsight.backend.scoring.InvestmentParameters;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Investment terms as entered by the user. Amounts are free text and may use
 * magnitude suffixes ("85 L", "1.2 Cr"); rates are percentages.
 * Unset optional fields fall back to the default assumptions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Investment terms for the cash flow analysis")
public class InvestmentInput {

    @Schema(description = "Purchase price", example = "85 L")
    private String price;

    @Schema(description = "Expected monthly rent", example = "35,000")
    private String monthlyRent;

    @Schema(description = "Explicit loan amount; derived from the down payment when absent", example = "60 L")
    private String loanAmount;

    private Double downPaymentPercent;
    private Double interestRatePercent;
    @Min(1) @Max(InvestmentParameters.MAX_YEARS)
    @Schema(description = "Loan term in years", example = "20")
    private Integer loanTermYears;

    @Min(1) @Max(InvestmentParameters.MAX_YEARS)
    @Schema(description = "Years until the property is sold", example = "10")
    private Integer holdingPeriodYears;
    private Double appreciationPercent;
    private Double expenseRatioPercent;
    private Double closingCostPercent;
    private Double sellingCostPercent;
}
