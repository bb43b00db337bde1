package com.raisket.advisor.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record ProjectionResponseDto(
        BigDecimal principal,
        BigDecimal annualRatePercent,
        int months,
        BigDecimal monthlyContribution,
        BigDecimal finalValue,
        BigDecimal totalContributed,
        BigDecimal gain,
        List<YearRow> yearly,
        String traceId
) {
    public record YearRow(int year, BigDecimal contributed, BigDecimal interest, BigDecimal balance) {
    }
}
