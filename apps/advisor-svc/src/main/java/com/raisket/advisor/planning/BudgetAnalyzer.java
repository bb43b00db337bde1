package com.raisket.advisor.planning;

import com.raisket.advisor.model.BudgetAnalysis;
import com.raisket.advisor.model.BudgetCategory;
import com.raisket.advisor.model.MonthlyBudget;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares a monthly budget against the 50/30/20 rule and classifies each bucket.
 */
@Component
public class BudgetAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BudgetAnalyzer.class);

    public static final String NECESSITIES = "Necessities";
    public static final String WANTS = "Wants";
    public static final String SAVINGS = "Savings";

    /** Overspend of at least this share of the recommended amount is reported as exceeded. */
    private static final BigDecimal EXCEEDED_TOLERANCE = new BigDecimal("0.20");
    private static final BigDecimal EMERGENCY_FUND_MIN_MONTHS = BigDecimal.valueOf(3);
    private static final BigDecimal EMERGENCY_FUND_MAX_MONTHS = BigDecimal.valueOf(6);

    private final RuleAllocator ruleAllocator;

    public BudgetAnalyzer(RuleAllocator ruleAllocator) {
        this.ruleAllocator = ruleAllocator;
    }

    public BudgetAnalysis analyze(MonthlyBudget budget) {
        PlanningInputValidator.validateBudget(budget).throwIfInvalid();

        BigDecimal income = budget.income();
        BigDecimal totalExpenses = budget.totalExpenses();
        BigDecimal disposable = budget.disposable();
        BigDecimal savingsActual = disposable.max(BigDecimal.ZERO);
        BigDecimal wantsActual = budget.variableExpenses().add(budget.leakExpenses());
        RuleAllocator.Allocation allocation = ruleAllocator.allocate(income);

        List<BudgetCategory> categories = List.of(
                spendingCategory(NECESSITIES, budget.fixedExpenses(), allocation.necessities(), income, RuleAllocator.NECESSITIES_PERCENT),
                spendingCategory(WANTS, wantsActual, allocation.wants(), income, RuleAllocator.WANTS_PERCENT),
                savingsCategory(disposable, allocation.savings(), income)
        );

        BudgetAnalysis.OverallStatus overallStatus = overallStatus(budget, disposable, allocation);
        List<String> recommendations = buildRecommendations(budget, wantsActual, disposable, allocation);
        log.debug("Budget analyzed: disposable={} status={}", disposable, overallStatus);

        return new BudgetAnalysis(
                Money.round(income),
                Money.round(totalExpenses),
                Money.round(disposable),
                Money.shareOf(savingsActual, income),
                categories,
                overallStatus,
                recommendations
        );
    }

    private static BudgetCategory spendingCategory(
            String name,
            BigDecimal actual,
            BigDecimal recommended,
            BigDecimal income,
            BigDecimal recommendedPercent) {
        return new BudgetCategory(
                name,
                Money.round(actual),
                recommended,
                Money.shareOf(actual, income),
                Money.round(recommendedPercent),
                Money.round(actual.subtract(recommended)),
                spendingStatus(actual, recommended)
        );
    }

    private static BudgetCategory savingsCategory(BigDecimal disposable, BigDecimal recommended, BigDecimal income) {
        BigDecimal actual = disposable.max(BigDecimal.ZERO);
        return new BudgetCategory(
                SAVINGS,
                Money.round(actual),
                recommended,
                Money.shareOf(actual, income),
                Money.round(RuleAllocator.SAVINGS_PERCENT),
                Money.round(actual.subtract(recommended)),
                savingsStatus(disposable, recommended)
        );
    }

    static BudgetCategory.Status spendingStatus(BigDecimal actual, BigDecimal recommended) {
        if (actual.compareTo(recommended) <= 0) {
            return BudgetCategory.Status.OK;
        }
        BigDecimal excess = actual.subtract(recommended);
        if (excess.compareTo(recommended.multiply(EXCEEDED_TOLERANCE)) >= 0) {
            return BudgetCategory.Status.EXCEEDED;
        }
        return BudgetCategory.Status.WARNING;
    }

    // savings are judged by shortfall, not excess
    static BudgetCategory.Status savingsStatus(BigDecimal disposable, BigDecimal recommended) {
        if (disposable.compareTo(recommended) >= 0) {
            return BudgetCategory.Status.OK;
        }
        if (disposable.signum() > 0) {
            return BudgetCategory.Status.WARNING;
        }
        return BudgetCategory.Status.EXCEEDED;
    }

    private static BudgetAnalysis.OverallStatus overallStatus(
            MonthlyBudget budget,
            BigDecimal disposable,
            RuleAllocator.Allocation allocation) {
        if (disposable.signum() <= 0) {
            return BudgetAnalysis.OverallStatus.CRITICAL;
        }
        if (disposable.compareTo(allocation.savings()) >= 0
                && budget.fixedExpenses().compareTo(allocation.necessities()) <= 0) {
            return BudgetAnalysis.OverallStatus.HEALTHY;
        }
        return BudgetAnalysis.OverallStatus.CAUTION;
    }

    private static List<String> buildRecommendations(
            MonthlyBudget budget,
            BigDecimal wantsActual,
            BigDecimal disposable,
            RuleAllocator.Allocation allocation) {
        List<String> recommendations = new ArrayList<>();
        if (budget.fixedExpenses().compareTo(allocation.necessities()) > 0) {
            recommendations.add("Fixed expenses of " + Money.format(budget.fixedExpenses())
                    + " are above the recommended 50% (" + Money.format(allocation.necessities())
                    + "). Review housing, transport and service contracts for savings.");
        }
        if (wantsActual.compareTo(allocation.wants()) > 0) {
            recommendations.add("Variable spending of " + Money.format(wantsActual)
                    + " is above the recommended 30% (" + Money.format(allocation.wants())
                    + "). Set a weekly limit for non-essential purchases.");
        }
        if (budget.leakExpenses().signum() > 0) {
            BigDecimal yearly = budget.leakExpenses().multiply(BigDecimal.valueOf(12));
            recommendations.add("Small everyday purchases add up to " + Money.format(budget.leakExpenses())
                    + " per month (" + Money.format(yearly) + " per year). Track them and cut the ones you do not value.");
        }
        if (disposable.signum() <= 0) {
            recommendations.add("You are spending " + Money.format(disposable.negate())
                    + " more than you earn. Cut expenses before taking on new commitments.");
        } else if (disposable.compareTo(allocation.savings()) < 0) {
            recommendations.add("Aim to save at least " + Money.format(allocation.savings())
                    + " per month (20% of income); you currently have " + Money.format(disposable) + " left over.");
        } else {
            recommendations.add("You meet the 20% savings target. Automate a transfer of "
                    + Money.format(allocation.savings()) + " on payday and invest the surplus.");
        }
        BigDecimal totalExpenses = budget.totalExpenses();
        BigDecimal emergencyMin = totalExpenses.multiply(EMERGENCY_FUND_MIN_MONTHS);
        if (totalExpenses.signum() > 0 && budget.currentSavings().compareTo(emergencyMin) < 0) {
            recommendations.add("Build an emergency fund of " + Money.format(emergencyMin) + " to "
                    + Money.format(totalExpenses.multiply(EMERGENCY_FUND_MAX_MONTHS))
                    + " (3 to 6 months of expenses); current savings are " + Money.format(budget.currentSavings()) + ".");
        }
        return recommendations;
    }
}
