package com.geoinsight.backend.scoring;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of {@link FinancialMetricsEngine#analyze}. Amounts are annual unless
 * the name says otherwise.
 */
@Value
@Builder
public class InvestmentMetrics {

    double purchasePrice;
    double loanPrincipal;
    double totalCashInvested;
    double monthlyPayment;
    double annualDebtService;
    double grossAnnualRent;
    double operatingExpenses;
    double netOperatingIncome;
    double annualCashFlow;
    double grossYield;
    double capRate;

    /** Null when there is no debt service. */
    Double debtServiceCoverageRatio;

    double cashOnCashReturn;
    double breakEvenOccupancy;

    /** Unclamped ratio; null when gross rent is zero. */
    Double breakEvenOccupancyRaw;

    /** Null when the annual cash flow is not positive. */
    Double paybackYears;

    double onePercentRuleRatio;
    double exitValue;
    double loanBalanceAtExit;
    double netSaleProceeds;
    List<Double> cashFlows;
    double irr;
    int irrIterations;
}
