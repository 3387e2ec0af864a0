package com.geoinsight.backend.scoring;

import com.geoinsight.backend.exception.InputParseException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Inputs of the discounted cash flow model. Monetary values share one
 * currency; ratios and rates are fractions ({@code 0.085} for 8.5%).
 *
 * <p>When {@code loanPrincipal} is null the loan is derived from the purchase
 * price and {@code downPaymentRatio}.
 */
@Getter
@ToString
public class InvestmentParameters {

    /**
     * Upper bound for the loan term and the holding period.
     */
    public static final int MAX_YEARS = 100;

    private final double purchasePrice;
    private final double monthlyRent;
    private final double operatingExpenseRatio;
    private final Double loanPrincipal;
    private final double downPaymentRatio;
    private final double annualInterestRate;
    private final int loanTermYears;
    private final int holdingPeriodYears;
    private final double annualAppreciationRate;
    private final double closingCostRatio;
    private final double capexReserveRatio;
    private final double sellingCostRatio;

    @Builder(toBuilder = true)
    public InvestmentParameters(double purchasePrice,
                                double monthlyRent,
                                double operatingExpenseRatio,
                                Double loanPrincipal,
                                double downPaymentRatio,
                                double annualInterestRate,
                                int loanTermYears,
                                int holdingPeriodYears,
                                double annualAppreciationRate,
                                double closingCostRatio,
                                double capexReserveRatio,
                                double sellingCostRatio) {
        requirePositive("purchasePrice", purchasePrice);
        requireNonNegative("monthlyRent", monthlyRent);
        requireRatio("operatingExpenseRatio", operatingExpenseRatio);
        requireRatio("downPaymentRatio", downPaymentRatio);
        requireNonNegative("annualInterestRate", annualInterestRate);
        requireNonNegative("annualAppreciationRate", annualAppreciationRate);
        requireRatio("closingCostRatio", closingCostRatio);
        requireRatio("capexReserveRatio", capexReserveRatio);
        requireRatio("sellingCostRatio", sellingCostRatio);
        if (loanPrincipal != null) {
            requireNonNegative("loanPrincipal", loanPrincipal);
            if (loanPrincipal > purchasePrice) {
                throw new InputParseException("loanPrincipal " + loanPrincipal
                        + " exceeds purchasePrice " + purchasePrice);
            }
        }
        requireYears("holdingPeriodYears", holdingPeriodYears);
        requireYears("loanTermYears", loanTermYears);
        this.purchasePrice = purchasePrice;
        this.monthlyRent = monthlyRent;
        this.operatingExpenseRatio = operatingExpenseRatio;
        this.loanPrincipal = loanPrincipal;
        this.downPaymentRatio = downPaymentRatio;
        this.annualInterestRate = annualInterestRate;
        this.loanTermYears = loanTermYears;
        this.holdingPeriodYears = holdingPeriodYears;
        this.annualAppreciationRate = annualAppreciationRate;
        this.closingCostRatio = closingCostRatio;
        this.capexReserveRatio = capexReserveRatio;
        this.sellingCostRatio = sellingCostRatio;
    }

    /**
     * Loan actually taken: the explicit principal or the financed share of the price.
     */
    public double effectiveLoanPrincipal() {
        return loanPrincipal != null ? loanPrincipal : purchasePrice * (1.0 - downPaymentRatio);
    }

    public double downPayment() {
        return purchasePrice - effectiveLoanPrincipal();
    }

    public double closingCosts() {
        return purchasePrice * closingCostRatio;
    }

    public double totalCashInvested() {
        return downPayment() + closingCosts();
    }

    private static void requirePositive(String field, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new InputParseException(field + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(String field, double value) {
        if (!(value >= 0) || !Double.isFinite(value)) {
            throw new InputParseException(field + " must be non-negative, got " + value);
        }
    }

    private static void requireYears(String field, int value) {
        if (value < 1 || value > MAX_YEARS) {
            throw new InputParseException(field + " must be between 1 and " + MAX_YEARS + ", got " + value);
        }
    }

    private static void requireRatio(String field, double value) {
        requireNonNegative(field, value);
        if (value > 1.0) {
            throw new InputParseException(field + " must be a fraction between 0 and 1, got " + value);
        }
    }

    /**
     * Builder seeded with the usual residential assumptions.
     */
    public static class InvestmentParametersBuilder {
        private double operatingExpenseRatio = 0.30;
        private double downPaymentRatio = 0.20;
        private double annualInterestRate = 0.085;
        private int loanTermYears = 20;
        private int holdingPeriodYears = 10;
        private double annualAppreciationRate = 0.05;
        private double closingCostRatio = 0.07;
        private double capexReserveRatio = 0.01;
        private double sellingCostRatio = 0.0;
    }
}
