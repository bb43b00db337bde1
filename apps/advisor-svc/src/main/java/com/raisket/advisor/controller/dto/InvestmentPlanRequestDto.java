package com.raisket.advisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.raisket.advisor.model.InvestmentPlan;
import com.raisket.advisor.model.RiskProfile;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record InvestmentPlanRequestDto(
        @NotNull @JsonAlias({"total_amount", "amount"}) BigDecimal totalAmount,
        @NotNull @JsonAlias("term_months") Integer termMonths,
        @NotBlank @JsonAlias("risk_profile") String riskProfile
) {
    public InvestmentPlan toPlan() {
        return new InvestmentPlan(totalAmount, termMonths, RiskProfile.parse(riskProfile));
    }
}
