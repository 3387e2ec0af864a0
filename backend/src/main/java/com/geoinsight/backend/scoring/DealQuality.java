package com.geoinsight.backend.scoring;

/**
 * Overall grade of a rental deal from its cash-on-cash return, debt coverage
 * and cash flow, with the matching buy/avoid recommendation.
 */
public enum DealQuality {

    EXCELLENT("STRONG BUY", "Outstanding returns, healthy debt coverage."),
    GOOD("BUY", "Solid cash flow and acceptable debt service."),
    FAIR("HOLD / NEGOTIATE", "Marginal returns; try to reduce the price or improve the rent."),
    POOR("AVOID / RENEGOTIATE", "Returns too low for the risk and capital locked in."),
    NEGATIVE_CASH_FLOW("AVOID", "Property costs more than it earns every month.");

    private final String recommendation;
    private final String rationale;

    DealQuality(String recommendation, String rationale) {
        this.recommendation = recommendation;
        this.rationale = rationale;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public String getRationale() {
        return rationale;
    }

    /**
     * A deal without a loan has no debt to cover and passes every DSCR bar.
     */
    public static DealQuality grade(InvestmentMetrics metrics) {
        if (metrics.getAnnualCashFlow() < 0) {
            return NEGATIVE_CASH_FLOW;
        }
        double coc = metrics.getCashOnCashReturn();
        Double dscr = metrics.getDebtServiceCoverageRatio();
        double coverage = dscr == null ? Double.POSITIVE_INFINITY : dscr;
        if (coc > 0.12 && coverage >= 1.25) {
            return EXCELLENT;
        }
        if (coc > 0.08 && coverage >= 1.0) {
            return GOOD;
        }
        if (coc > 0.05) {
            return FAIR;
        }
        return POOR;
    }
}
