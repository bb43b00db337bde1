package com.raisket.advisor.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record PortfolioResponseDto(
        String riskProfile,
        BigDecimal totalAmount,
        int termMonths,
        List<InstrumentAllocation> instruments,
        BigDecimal blendedAnnualReturn,
        ProjectionResponseDto projection,
        String overallRisk,
        List<String> notes,
        String narrative,
        boolean narrativeGenerated,
        String traceId
) {
    public record InstrumentAllocation(
            String name,
            String assetClass,
            BigDecimal weightPercent,
            BigDecimal expectedAnnualReturn,
            String riskLevel,
            String liquidity,
            BigDecimal amount) {
    }
}
