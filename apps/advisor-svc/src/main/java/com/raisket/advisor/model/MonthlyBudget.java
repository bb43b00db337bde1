package com.raisket.advisor.model;

import java.math.BigDecimal;

/**
 * One month of household cash flow as reported by the user.
 * <p>
 * {@code leakExpenses} are small discretionary purchases ("gastos hormiga") that are tracked apart from
 * the regular variable spend.
 */
public record MonthlyBudget(
        BigDecimal income,
        BigDecimal fixedExpenses,
        BigDecimal variableExpenses,
        BigDecimal leakExpenses,
        BigDecimal currentSavings
) {

    public BigDecimal totalExpenses() {
        return fixedExpenses.add(variableExpenses).add(leakExpenses);
    }

    public BigDecimal disposable() {
        return income.subtract(totalExpenses());
    }
}
