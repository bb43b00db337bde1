package com.raisket.advisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record ProjectionRequestDto(
        @NotNull @JsonAlias("initial_deposit") BigDecimal principal,
        @NotNull @JsonAlias({"annual_rate", "interest_rate"}) BigDecimal annualRate,
        @NotNull @Min(1) Integer months,
        @JsonAlias("monthly_contribution") BigDecimal monthlyContribution
) {
    public BigDecimal monthlyContributionOrZero() {
        return monthlyContribution == null ? BigDecimal.ZERO : monthlyContribution;
    }
}
