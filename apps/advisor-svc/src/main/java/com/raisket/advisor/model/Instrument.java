package com.raisket.advisor.model;

import java.math.BigDecimal;

/**
 * One entry of a portfolio template. Rates and weights are percentages.
 */
public record Instrument(
        String name,
        AssetClass assetClass,
        BigDecimal weightPercent,
        BigDecimal expectedAnnualReturn,
        RiskLevel riskLevel,
        Liquidity liquidity
) {
    public enum AssetClass {
        FIXED_INCOME,
        EQUITY,
        MIXED
    }

    public enum RiskLevel {
        LOW,
        MEDIUM,
        HIGH
    }

    public enum Liquidity {
        IMMEDIATE,
        SHORT_TERM,
        LONG_TERM
    }
}
