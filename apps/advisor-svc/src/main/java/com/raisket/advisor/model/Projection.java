package com.raisket.advisor.model;

import java.math.BigDecimal;

public record Projection(
        BigDecimal principal,
        BigDecimal annualRatePercent,
        int months,
        BigDecimal monthlyContribution,
        BigDecimal finalValue,
        BigDecimal totalContributed,
        BigDecimal gain
) {
}
