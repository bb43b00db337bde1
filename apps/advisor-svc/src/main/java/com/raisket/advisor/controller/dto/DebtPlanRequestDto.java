package com.raisket.advisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.raisket.advisor.model.Debt;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;

public record DebtPlanRequestDto(
        @NotEmpty List<@Valid DebtDto> debts,
        @NotNull @JsonAlias("monthly_income_available") BigDecimal monthlyIncomeAvailable,
        @NotBlank String strategy
) {
    public record DebtDto(
            @NotBlank String name,
            @NotNull BigDecimal principal,
            @NotNull @JsonAlias({"annual_rate", "interest_rate"}) BigDecimal annualRate,
            @NotNull @JsonAlias("minimum_payment") BigDecimal minimumPayment,
            @JsonAlias("term_months") Integer termMonths
    ) {
        public Debt toDebt() {
            return new Debt(name, principal, annualRate, minimumPayment, termMonths);
        }
    }

    public List<Debt> toDebts() {
        return debts.stream().map(DebtDto::toDebt).toList();
    }
}
