package com.geoinsight.backend.scoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Cash-flow projection and the derived investment ratios.
 *
 * <p>Loan payments follow the standard amortization formula with monthly
 * compounding. Debt service stops once the loan term ends inside the holding
 * period.
 */
public class FinancialMetricsEngine {

    private final IrrSolver irrSolver;

    public FinancialMetricsEngine(IrrSolver irrSolver) {
        this.irrSolver = irrSolver;
    }

    /**
     * Metrics including IRR.
     *
     * @throws com.geoinsight.backend.exception.NonConvergenceException when the IRR cannot be found
     *                                                                   from {@code irrConfig}'s initial guess
     */
    public InvestmentMetrics analyze(InvestmentParameters params, IrrSolverConfig irrConfig) {
        double principal = params.effectiveLoanPrincipal();
        double monthlyPayment = monthlyPayment(principal, params.getAnnualInterestRate(), params.getLoanTermYears());
        double debtService = monthlyPayment * 12.0;

        double grossRent = params.getMonthlyRent() * 12.0;
        double operatingExpenses = grossRent * params.getOperatingExpenseRatio();
        double noi = grossRent - operatingExpenses;
        double annualCashFlow = noi - debtService - capexReserve(params);
        double invested = params.totalCashInvested();

        Double dscr = debtService > 0 ? noi / debtService : null;
        Double breakEvenRaw = grossRent > 0 ? (operatingExpenses + debtService) / grossRent : null;
        double breakEven = breakEvenRaw == null ? 1.0 : clamp(breakEvenRaw);

        double exitValue = exitValue(params);
        double balanceAtExit = remainingBalance(principal, params.getAnnualInterestRate(),
                params.getLoanTermYears(), params.getHoldingPeriodYears() * 12);
        double netSaleProceeds = exitValue * (1.0 - params.getSellingCostRatio()) - balanceAtExit;

        double[] cashFlows = projectCashFlows(params);
        IrrResult irr = irrSolver.solve(cashFlows, irrConfig);

        List<Double> series = new ArrayList<>(cashFlows.length);
        for (double cashFlow : cashFlows) {
            series.add(cashFlow);
        }

        return InvestmentMetrics.builder()
                .purchasePrice(params.getPurchasePrice())
                .loanPrincipal(principal)
                .totalCashInvested(invested)
                .monthlyPayment(monthlyPayment)
                .annualDebtService(debtService)
                .grossAnnualRent(grossRent)
                .operatingExpenses(operatingExpenses)
                .netOperatingIncome(noi)
                .annualCashFlow(annualCashFlow)
                .grossYield(grossRent / params.getPurchasePrice())
                .capRate(noi / params.getPurchasePrice())
                .debtServiceCoverageRatio(dscr)
                .cashOnCashReturn(invested > 0 ? annualCashFlow / invested : 0.0)
                .breakEvenOccupancy(breakEven)
                .breakEvenOccupancyRaw(breakEvenRaw)
                .paybackYears(annualCashFlow > 0 ? invested / annualCashFlow : null)
                .onePercentRuleRatio(params.getMonthlyRent() / params.getPurchasePrice())
                .exitValue(exitValue)
                .loanBalanceAtExit(balanceAtExit)
                .netSaleProceeds(netSaleProceeds)
                .cashFlows(series)
                .irr(irr.rate())
                .irrIterations(irr.iterations())
                .build();
    }

    /**
     * Year 0 is the cash invested as an outflow, years 1..N the net cash flow,
     * with the net sale proceeds added to year N.
     */
    public double[] projectCashFlows(InvestmentParameters params) {
        int years = params.getHoldingPeriodYears();
        double principal = params.effectiveLoanPrincipal();
        double annualDebtService = monthlyPayment(principal, params.getAnnualInterestRate(),
                params.getLoanTermYears()) * 12.0;

        double grossRent = params.getMonthlyRent() * 12.0;
        double noi = grossRent * (1.0 - params.getOperatingExpenseRatio());
        double capex = capexReserve(params);

        double[] cashFlows = new double[years + 1];
        cashFlows[0] = -params.totalCashInvested();
        for (int year = 1; year <= years; year++) {
            double debtService = year <= params.getLoanTermYears() ? annualDebtService : 0.0;
            cashFlows[year] = noi - debtService - capex;
        }

        double balance = remainingBalance(principal, params.getAnnualInterestRate(),
                params.getLoanTermYears(), years * 12);
        cashFlows[years] += exitValue(params) * (1.0 - params.getSellingCostRatio()) - balance;
        return cashFlows;
    }

    public double monthlyPayment(double principal, double annualRate, int termYears) {
        if (principal <= 0) {
            return 0.0;
        }
        int payments = termYears * 12;
        double rate = annualRate / 12.0;
        if (rate == 0) {
            return principal / payments;
        }
        double growth = Math.pow(1.0 + rate, payments);
        return principal * rate * growth / (growth - 1.0);
    }

    /**
     * Outstanding principal after {@code paymentsMade} monthly payments.
     */
    public double remainingBalance(double principal, double annualRate, int termYears, int paymentsMade) {
        int payments = termYears * 12;
        if (principal <= 0 || paymentsMade >= payments) {
            return 0.0;
        }
        double rate = annualRate / 12.0;
        if (rate == 0) {
            return principal * (1.0 - (double) paymentsMade / payments);
        }
        double total = Math.pow(1.0 + rate, payments);
        double made = Math.pow(1.0 + rate, paymentsMade);
        return principal * (total - made) / (total - 1.0);
    }

    private static double capexReserve(InvestmentParameters params) {
        return params.getPurchasePrice() * params.getCapexReserveRatio();
    }

    private static double exitValue(InvestmentParameters params) {
        return params.getPurchasePrice()
                * Math.pow(1.0 + params.getAnnualAppreciationRate(), params.getHoldingPeriodYears());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
