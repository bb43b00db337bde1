package com.raisket.advisor.model;

import java.math.BigDecimal;

/**
 * A lump sum invested for {@code termMonths} under a risk profile. Contribution streams are projected
 * separately.
 */
public record InvestmentPlan(
        BigDecimal totalAmount,
        int termMonths,
        RiskProfile riskProfile
) {
}
