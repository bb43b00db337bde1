package com.raisket.advisor.model;

import java.math.BigDecimal;
import java.util.List;

public record PortfolioRecommendation(
        InvestmentPlan plan,
        List<InstrumentAllocation> allocations,
        BigDecimal blendedAnnualReturn,
        Projection projection,
        Instrument.RiskLevel overallRisk,
        List<String> notes
) {
    public PortfolioRecommendation {
        allocations = List.copyOf(allocations);
        notes = List.copyOf(notes);
    }
}
