package com.raisket.advisor.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record DebtPlanResponseDto(
        String strategy,
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
        List<String> recommendations,
        String narrative,
        boolean narrativeGenerated,
        String traceId
) {
    public record DebtAnalysis(
            String name,
            BigDecimal principal,
            BigDecimal annualRate,
            BigDecimal monthlyInterest,
            BigDecimal minimumPayment,
            BigDecimal recommendedPayment,
            int monthsToPayoff,
            BigDecimal totalInterest,
            BigDecimal totalPaid,
            int priority,
            boolean paidOff,
            boolean highCost) {
    }
}
