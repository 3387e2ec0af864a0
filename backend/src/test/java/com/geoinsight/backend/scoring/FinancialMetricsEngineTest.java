package com.geoinsight.backend.scoring;

import com.geoinsight.backend.exception.InputParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FinancialMetricsEngineTest {

    private final IrrSolver irrSolver = new IrrSolver();
    private final FinancialMetricsEngine engine = new FinancialMetricsEngine(irrSolver);

    @Test
    void shouldComputeLeveragedMetrics() {
        // Given 1,000,000 price, 10,000 monthly rent, default financing
        InvestmentParameters params = InvestmentParameters.builder()
                .purchasePrice(1_000_000)
                .monthlyRent(10_000)
                .build();

        // When
        InvestmentMetrics metrics = engine.analyze(params, IrrSolverConfig.defaults());

        // Then
        assertThat(metrics.getLoanPrincipal()).isEqualTo(800_000.0);
        assertThat(metrics.getTotalCashInvested()).isCloseTo(270_000.0, within(1e-6));
        assertThat(metrics.getGrossAnnualRent()).isEqualTo(120_000.0);
        assertThat(metrics.getNetOperatingIncome()).isCloseTo(84_000.0, within(1e-6));
        assertThat(metrics.getCapRate()).isCloseTo(0.084, within(1e-9));
        assertThat(metrics.getGrossYield()).isCloseTo(0.12, within(1e-9));
        assertThat(metrics.getOnePercentRuleRatio()).isCloseTo(0.01, within(1e-12));
        assertThat(metrics.getMonthlyPayment()).isCloseTo(6_942.6, within(1.0));
        assertThat(metrics.getDebtServiceCoverageRatio())
                .isCloseTo(84_000.0 / metrics.getAnnualDebtService(), within(1e-12));
        assertThat(metrics.getBreakEvenOccupancy()).isEqualTo(metrics.getBreakEvenOccupancyRaw());
        assertThat(metrics.getCashFlows()).hasSize(11);
        assertThat(metrics.getCashFlows().get(0)).isCloseTo(-270_000.0, within(1e-6));
        assertThat(irrSolver.npv(toArray(metrics), metrics.getIrr())).isCloseTo(0.0, within(1e-6));
        assertThat(metrics.getIrr()).isBetween(0.10, 0.15);
    }

    @Test
    void shouldReportNoDscrWithoutLoan() {
        InvestmentParameters params = InvestmentParameters.builder()
                .purchasePrice(1_000_000)
                .monthlyRent(10_000)
                .loanPrincipal(0.0)
                .build();

        InvestmentMetrics metrics = engine.analyze(params, IrrSolverConfig.defaults());

        assertThat(metrics.getDebtServiceCoverageRatio()).isNull();
        assertThat(metrics.getMonthlyPayment()).isZero();
        assertThat(metrics.getLoanBalanceAtExit()).isZero();
        assertThat(metrics.getTotalCashInvested()).isCloseTo(1_070_000.0, within(1e-6));
        assertThat(metrics.getAnnualCashFlow()).isCloseTo(74_000.0, within(1e-6));
        assertThat(metrics.getPaybackYears()).isCloseTo(1_070_000.0 / 74_000.0, within(1e-9));
    }

    @Test
    void shouldStopDebtServiceAfterLoanTerm() {
        InvestmentParameters params = InvestmentParameters.builder()
                .purchasePrice(500_000)
                .monthlyRent(5_000)
                .loanTermYears(5)
                .holdingPeriodYears(10)
                .build();

        double[] cashFlows = engine.projectCashFlows(params);

        double unlevered = 5_000 * 12 * 0.7 - 500_000 * 0.01;
        assertThat(cashFlows[6]).isCloseTo(unlevered, within(1e-6));
        assertThat(cashFlows[5]).isLessThan(cashFlows[6] + 1e-6);
        assertThat(cashFlows[1]).isLessThan(cashFlows[6]);
    }

    @Test
    void shouldAmortizeToZero() {
        double payment = engine.monthlyPayment(100_000, 0.06, 30);

        assertThat(payment).isCloseTo(599.55, within(0.01));
        assertThat(engine.remainingBalance(100_000, 0.06, 30, 0)).isCloseTo(100_000.0, within(1e-6));
        assertThat(engine.remainingBalance(100_000, 0.06, 30, 360)).isZero();
        assertThat(engine.monthlyPayment(120_000, 0.0, 10)).isCloseTo(1_000.0, within(1e-9));
        assertThat(engine.remainingBalance(120_000, 0.0, 10, 60)).isCloseTo(60_000.0, within(1e-9));
    }

    @Test
    void shouldRejectInvalidTerms() {
        assertThatThrownBy(() -> InvestmentParameters.builder().purchasePrice(0).monthlyRent(1_000).build())
                .isInstanceOf(InputParseException.class)
                .hasMessageContaining("purchasePrice");
        assertThatThrownBy(() -> InvestmentParameters.builder()
                .purchasePrice(100_000).monthlyRent(1_000).loanPrincipal(150_000.0).build())
                .isInstanceOf(InputParseException.class);
        assertThatThrownBy(() -> InvestmentParameters.builder()
                .purchasePrice(100_000).monthlyRent(1_000).operatingExpenseRatio(1.5).build())
                .isInstanceOf(InputParseException.class);
        assertThatThrownBy(() -> InvestmentParameters.builder()
                .purchasePrice(100_000).monthlyRent(1_000).holdingPeriodYears(0).build())
                .isInstanceOf(InputParseException.class);
    }

    @Test
    void shouldRejectTermsBeyondHundredYears() {
        assertThatThrownBy(() -> InvestmentParameters.builder()
                .purchasePrice(10_000_000).monthlyRent(50_000).loanPrincipal(8_000_000.0)
                .loanTermYears(200_000_000).build())
                .isInstanceOf(InputParseException.class)
                .hasMessageContaining("loanTermYears");
        assertThatThrownBy(() -> InvestmentParameters.builder()
                .purchasePrice(100_000).monthlyRent(1_000).holdingPeriodYears(Integer.MAX_VALUE).build())
                .isInstanceOf(InputParseException.class)
                .hasMessageContaining("holdingPeriodYears");
        assertThatThrownBy(() -> InvestmentParameters.builder()
                .purchasePrice(100_000).monthlyRent(1_000).loanTermYears(101).build())
                .isInstanceOf(InputParseException.class);
    }

    @Test
    void shouldAcceptHundredYearTerms() {
        InvestmentParameters params = InvestmentParameters.builder()
                .purchasePrice(1_000_000)
                .monthlyRent(10_000)
                .loanTermYears(InvestmentParameters.MAX_YEARS)
                .holdingPeriodYears(InvestmentParameters.MAX_YEARS)
                .build();

        double[] cashFlows = engine.projectCashFlows(params);

        assertThat(cashFlows).hasSize(101);
        assertThat(engine.monthlyPayment(800_000, 0.085, InvestmentParameters.MAX_YEARS)).isPositive();
    }

    private static double[] toArray(InvestmentMetrics metrics) {
        return metrics.getCashFlows().stream().mapToDouble(Double::doubleValue).toArray();
    }
}
