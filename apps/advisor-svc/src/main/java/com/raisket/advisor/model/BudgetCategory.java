package com.raisket.advisor.model;

import java.math.BigDecimal;

public record BudgetCategory(
        String name,
        BigDecimal actualAmount,
        BigDecimal recommendedAmount,
        BigDecimal actualPercent,
        BigDecimal recommendedPercent,
        BigDecimal delta,
        Status status
) {
    public enum Status {
        OK,
        WARNING,
        EXCEEDED
    }
}
