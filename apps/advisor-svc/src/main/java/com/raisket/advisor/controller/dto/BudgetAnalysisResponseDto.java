package com.raisket.advisor.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record BudgetAnalysisResponseDto(
        BigDecimal income,
        BigDecimal totalExpenses,
        BigDecimal disposable,
        BigDecimal savingsRatePercent,
        List<Category> categories,
        String overallStatus,
        List<String> recommendations,
        String narrative,
        boolean narrativeGenerated,
        String traceId
) {
    public record Category(
            String name,
            BigDecimal actualAmount,
            BigDecimal recommendedAmount,
            BigDecimal actualPercent,
            BigDecimal recommendedPercent,
            BigDecimal delta,
            String status) {
    }
}
