package com.raisket.advisor.model;

import java.math.BigDecimal;
import java.util.List;

public record BudgetAnalysis(
        BigDecimal income,
        BigDecimal totalExpenses,
        BigDecimal disposable,
        BigDecimal savingsRatePercent,
        List<BudgetCategory> categories,
        OverallStatus overallStatus,
        List<String> recommendations
) {
    public BudgetAnalysis {
        categories = List.copyOf(categories);
        recommendations = List.copyOf(recommendations);
    }

    public enum OverallStatus {
        HEALTHY,
        CAUTION,
        CRITICAL
    }
}
