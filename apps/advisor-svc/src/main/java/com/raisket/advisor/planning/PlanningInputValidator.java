package com.raisket.advisor.planning;

import com.raisket.advisor.model.Debt;
import com.raisket.advisor.model.InvestmentPlan;
import com.raisket.advisor.model.MonthlyBudget;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Field-level checks run before any planning computation. Each method collects every violation instead of
 * stopping at the first one.
 */
public final class PlanningInputValidator {

    public static final BigDecimal MAX_ANNUAL_RATE = BigDecimal.valueOf(200);
    public static final int MAX_INVESTMENT_TERM_MONTHS = 360;
    public static final int MAX_SCHEDULE_YEARS = 50;
    public static final int MAX_PROJECTION_MONTHS = MAX_SCHEDULE_YEARS * 12;

    private PlanningInputValidator() {
    }

    public static ValidationResult validateIncome(BigDecimal income) {
        List<String> violations = new ArrayList<>();
        requirePositive(violations, "income", income);
        return new ValidationResult(violations);
    }

    public static ValidationResult validateBudget(MonthlyBudget budget) {
        if (budget == null) {
            return new ValidationResult(List.of("budget must be provided"));
        }
        List<String> violations = new ArrayList<>();
        requirePositive(violations, "income", budget.income());
        requireNonNegative(violations, "fixedExpenses", budget.fixedExpenses());
        requireNonNegative(violations, "variableExpenses", budget.variableExpenses());
        requireNonNegative(violations, "leakExpenses", budget.leakExpenses());
        requireNonNegative(violations, "currentSavings", budget.currentSavings());
        return new ValidationResult(violations);
    }

    public static ValidationResult validateDebtRequest(List<Debt> debts, BigDecimal monthlyIncomeAvailable) {
        List<String> violations = new ArrayList<>();
        requirePositive(violations, "monthlyIncomeAvailable", monthlyIncomeAvailable);
        if (debts == null || debts.isEmpty()) {
            violations.add("at least one debt must be provided");
            return new ValidationResult(violations);
        }
        for (int i = 0; i < debts.size(); i++) {
            Debt debt = debts.get(i);
            String prefix = "debts[" + i + "].";
            if (debt == null) {
                violations.add("debts[" + i + "] must not be null");
                continue;
            }
            if (debt.name() == null || debt.name().isBlank()) {
                violations.add(prefix + "name must not be blank");
            }
            requirePositive(violations, prefix + "principal", debt.principal());
            requireRate(violations, prefix + "annualRate", debt.annualRate());
            requirePositive(violations, prefix + "minimumPayment", debt.minimumPayment());
            if (debt.termMonths() != null && debt.termMonths() <= 0) {
                violations.add(prefix + "termMonths must be positive when provided");
            }
        }
        return new ValidationResult(violations);
    }

    public static ValidationResult validateAmortization(BigDecimal principal, BigDecimal annualRatePercent, BigDecimal payment) {
        List<String> violations = new ArrayList<>();
        requirePositive(violations, "principal", principal);
        requireRate(violations, "annualRate", annualRatePercent);
        requirePositive(violations, "monthlyPayment", payment);
        return new ValidationResult(violations);
    }

    public static ValidationResult validateInstallment(BigDecimal principal, BigDecimal annualRatePercent, int termMonths) {
        List<String> violations = new ArrayList<>();
        requirePositive(violations, "principal", principal);
        requireRate(violations, "annualRate", annualRatePercent);
        if (termMonths <= 0) {
            violations.add("termMonths must be positive");
        }
        return new ValidationResult(violations);
    }

    public static ValidationResult validateInvestmentPlan(InvestmentPlan plan) {
        if (plan == null) {
            return new ValidationResult(List.of("investment plan must be provided"));
        }
        List<String> violations = new ArrayList<>();
        requirePositive(violations, "totalAmount", plan.totalAmount());
        if (plan.termMonths() <= 0 || plan.termMonths() > MAX_INVESTMENT_TERM_MONTHS) {
            violations.add("termMonths must be between 1 and " + MAX_INVESTMENT_TERM_MONTHS);
        }
        if (plan.riskProfile() == null) {
            violations.add("riskProfile must be provided");
        }
        return new ValidationResult(violations);
    }

    public static ValidationResult validateProjection(BigDecimal principal, BigDecimal annualRatePercent, int months,
            BigDecimal monthlyContribution) {
        List<String> violations = new ArrayList<>();
        requireNonNegative(violations, "principal", principal);
        requireNonNegative(violations, "annualRate", annualRatePercent);
        if (months <= 0 || months > MAX_PROJECTION_MONTHS) {
            violations.add("months must be between 1 and " + MAX_PROJECTION_MONTHS);
        }
        requireNonNegative(violations, "monthlyContribution", monthlyContribution);
        return new ValidationResult(violations);
    }

    public static ValidationResult validateSchedule(BigDecimal principal, BigDecimal annualRatePercent, int years,
            BigDecimal monthlyContribution) {
        List<String> violations = new ArrayList<>();
        requireNonNegative(violations, "principal", principal);
        requireNonNegative(violations, "annualRate", annualRatePercent);
        if (years <= 0 || years > MAX_SCHEDULE_YEARS) {
            violations.add("years must be between 1 and " + MAX_SCHEDULE_YEARS);
        }
        requireNonNegative(violations, "monthlyContribution", monthlyContribution);
        return new ValidationResult(violations);
    }

    private static void requirePositive(List<String> violations, String field, BigDecimal value) {
        if (value == null) {
            violations.add(field + " must be provided");
        } else if (value.signum() <= 0) {
            violations.add(field + " must be greater than 0");
        }
    }

    private static void requireNonNegative(List<String> violations, String field, BigDecimal value) {
        if (value == null) {
            violations.add(field + " must be provided");
        } else if (value.signum() < 0) {
            violations.add(field + " must not be negative");
        }
    }

    private static void requireRate(List<String> violations, String field, BigDecimal value) {
        if (value == null) {
            violations.add(field + " must be provided");
        } else if (value.signum() < 0 || value.compareTo(MAX_ANNUAL_RATE) > 0) {
            violations.add(field + " must be between 0 and " + MAX_ANNUAL_RATE);
        }
    }
}
