package com.geoinsight.backend.service;

import com.geoinsight.backend.config.ScoringProperties;
import com.geoinsight.backend.dto.InvestmentAnalysisResponse;
import com.geoinsight.backend.exception.InputParseException;
import com.geoinsight.backend.exception.NonConvergenceException;
import com.geoinsight.backend.model.InvestmentInput;
import com.geoinsight.backend.scoring.AmountParser;
import com.geoinsight.backend.scoring.DealQuality;
import com.geoinsight.backend.scoring.FinancialMetricsEngine;
import com.geoinsight.backend.scoring.InvestmentMetrics;
import com.geoinsight.backend.scoring.InvestmentParameters;
import com.geoinsight.backend.scoring.IrrSolverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns user-entered investment terms into metrics, retrying the IRR from
 * the configured fallback guesses when Newton iteration fails.
 */
@Service
public class InvestmentAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(InvestmentAnalysisService.class);

    private final AmountParser amountParser;
    private final FinancialMetricsEngine metricsEngine;
    private final ScoringProperties scoringProperties;

    public InvestmentAnalysisService(AmountParser amountParser,
            FinancialMetricsEngine metricsEngine,
            ScoringProperties scoringProperties) {
        this.amountParser = amountParser;
        this.metricsEngine = metricsEngine;
        this.scoringProperties = scoringProperties;
    }

    /**
     * Parse the input and compute the metrics.
     */
    public InvestmentAnalysisResponse analyze(InvestmentInput input) {
        return analyze(toParameters(input));
    }

    /**
     * Compute the metrics, trying each initial guess in turn.
     *
     * @throws NonConvergenceException from the last guess when none converges
     */
    public InvestmentAnalysisResponse analyze(InvestmentParameters parameters) {
        IrrSolverConfig base = scoringProperties.toIrrSolverConfig();
        List<Double> guesses = new ArrayList<>();
        guesses.add(base.initialGuess());
        scoringProperties.getIrr().getFallbackGuesses().stream()
                .filter(g -> g > -1.0 && !guesses.contains(g))
                .forEach(guesses::add);

        NonConvergenceException lastFailure = null;
        for (double guess : guesses) {
            try {
                InvestmentMetrics metrics = metricsEngine.analyze(parameters, base.withInitialGuess(guess));
                DealQuality quality = DealQuality.grade(metrics);
                return InvestmentAnalysisResponse.builder()
                        .metrics(metrics)
                        .dscrRating(dscrRating(metrics.getDebtServiceCoverageRatio()))
                        .quality(quality)
                        .recommendation(quality.getRecommendation())
                        .rationale(quality.getRationale())
                        .irrInitialGuess(guess)
                        .build();
            } catch (NonConvergenceException e) {
                log.debug("IRR did not converge from guess {}: {}", guess, e.getMessage());
                lastFailure = e;
            }
        }
        throw lastFailure;
    }

    public InvestmentParameters toParameters(InvestmentInput input) {
        if (input == null) {
            throw new InputParseException("Investment input is missing");
        }
        if (input.getPrice() == null || input.getPrice().isBlank()) {
            throw new InputParseException("price is required");
        }
        if (input.getMonthlyRent() == null || input.getMonthlyRent().isBlank()) {
            throw new InputParseException("monthlyRent is required");
        }

        InvestmentParameters.InvestmentParametersBuilder builder = InvestmentParameters.builder()
                .purchasePrice(amountParser.parse(input.getPrice()))
                .monthlyRent(amountParser.parse(input.getMonthlyRent()));

        if (input.getLoanAmount() != null && !input.getLoanAmount().isBlank()) {
            builder.loanPrincipal(amountParser.parse(input.getLoanAmount()));
        }
        if (input.getDownPaymentPercent() != null) {
            builder.downPaymentRatio(percent(input.getDownPaymentPercent()));
        }
        if (input.getInterestRatePercent() != null) {
            builder.annualInterestRate(percent(input.getInterestRatePercent()));
        }
        if (input.getLoanTermYears() != null) {
            builder.loanTermYears(input.getLoanTermYears());
        }
        if (input.getHoldingPeriodYears() != null) {
            builder.holdingPeriodYears(input.getHoldingPeriodYears());
        }
        if (input.getAppreciationPercent() != null) {
            builder.annualAppreciationRate(percent(input.getAppreciationPercent()));
        }
        if (input.getExpenseRatioPercent() != null) {
            builder.operatingExpenseRatio(percent(input.getExpenseRatioPercent()));
        }
        if (input.getClosingCostPercent() != null) {
            builder.closingCostRatio(percent(input.getClosingCostPercent()));
        }
        if (input.getSellingCostPercent() != null) {
            builder.sellingCostRatio(percent(input.getSellingCostPercent()));
        }
        return builder.build();
    }

    /**
     * Lender-style rating of the debt service coverage ratio.
     */
    public static String dscrRating(Double dscr) {
        if (dscr == null) {
            return "N/A (no loan)";
        }
        if (dscr >= 1.5) {
            return "Excellent";
        }
        if (dscr >= 1.25) {
            return "Good";
        }
        if (dscr >= 1.0) {
            return "Marginal";
        }
        return "Risky";
    }

    private static double percent(double value) {
        return value / 100.0;
    }
}
