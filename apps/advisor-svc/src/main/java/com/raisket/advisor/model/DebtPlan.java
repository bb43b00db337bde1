package com.raisket.advisor.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregated payoff plan. {@code debts} is ordered by priority.
 */
public record DebtPlan(
        Strategy strategy,
        List<DebtAnalysis> debts,
        BigDecimal totalPrincipal,
        BigDecimal totalMinimumPayment,
        BigDecimal totalInterest,
        int projectedMonths,
        BigDecimal monthlyIncomeAvailable,
        BigDecimal extraCapacity,
        List<String> payoffOrder,
        List<String> highCostDebts,
        boolean allPaidOff,
        List<String> recommendations
) {
    public DebtPlan {
        debts = List.copyOf(debts);
        payoffOrder = List.copyOf(payoffOrder);
        highCostDebts = List.copyOf(highCostDebts);
        recommendations = List.copyOf(recommendations);
    }
}
