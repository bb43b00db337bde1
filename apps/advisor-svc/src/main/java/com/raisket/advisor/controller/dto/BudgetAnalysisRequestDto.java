package com.raisket.advisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.raisket.advisor.model.MonthlyBudget;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record BudgetAnalysisRequestDto(
        @NotNull @JsonAlias("monthly_income") BigDecimal income,
        @NotNull @JsonAlias("fixed_expenses") BigDecimal fixedExpenses,
        @NotNull @JsonAlias("variable_expenses") BigDecimal variableExpenses,
        @JsonAlias({"leak_expenses", "ant_expenses"}) BigDecimal leakExpenses,
        @JsonAlias("current_savings") BigDecimal currentSavings
) {
    public MonthlyBudget toBudget() {
        return new MonthlyBudget(
                income,
                fixedExpenses,
                variableExpenses,
                leakExpenses == null ? BigDecimal.ZERO : leakExpenses,
                currentSavings == null ? BigDecimal.ZERO : currentSavings
        );
    }
}
