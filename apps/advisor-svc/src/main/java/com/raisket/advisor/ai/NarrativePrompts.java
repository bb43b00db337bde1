package com.raisket.advisor.ai;

import com.raisket.advisor.model.BudgetAnalysis;
import com.raisket.advisor.model.BudgetCategory;
import com.raisket.advisor.model.DebtAnalysis;
import com.raisket.advisor.model.DebtPlan;
import com.raisket.advisor.model.InstrumentAllocation;
import com.raisket.advisor.model.PortfolioRecommendation;
import com.raisket.advisor.planning.Money;
import java.util.Locale;

/**
 * Builds the user prompt for each analysis from the computed figures only. Same analysis, same prompt.
 */
public final class NarrativePrompts {

    public static final String SYSTEM_PROMPT = "You are Raisket's personal finance advisor. "
            + "Explain the figures you are given in plain language, in at most three short paragraphs. "
            + "Never change or recompute the numbers and never recommend specific financial institutions.";

    private NarrativePrompts() {
    }

    public static String budget(BudgetAnalysis analysis) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Monthly budget analysis (50/30/20 rule)\n");
        prompt.append("Income: ").append(Money.format(analysis.income())).append('\n');
        prompt.append("Total expenses: ").append(Money.format(analysis.totalExpenses())).append('\n');
        prompt.append("Disposable: ").append(Money.format(analysis.disposable())).append('\n');
        prompt.append("Savings rate: ").append(Money.formatPercent(analysis.savingsRatePercent())).append('\n');
        prompt.append("Overall status: ").append(label(analysis.overallStatus())).append('\n');
        for (BudgetCategory category : analysis.categories()) {
            prompt.append("- ").append(category.name())
                    .append(": actual ").append(Money.format(category.actualAmount()))
                    .append(" (").append(Money.formatPercent(category.actualPercent())).append(")")
                    .append(", recommended ").append(Money.format(category.recommendedAmount()))
                    .append(" (").append(Money.formatPercent(category.recommendedPercent())).append(")")
                    .append(", status ").append(label(category.status()))
                    .append('\n');
        }
        appendList(prompt, "Recommendations", analysis.recommendations());
        prompt.append("Write a short, encouraging summary with the two most important next steps.");
        return prompt.toString();
    }

    public static String debts(DebtPlan plan) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Debt payoff plan, strategy ").append(label(plan.strategy())).append('\n');
        prompt.append("Total principal: ").append(Money.format(plan.totalPrincipal())).append('\n');
        prompt.append("Total minimum payments: ").append(Money.format(plan.totalMinimumPayment())).append('\n');
        prompt.append("Income available for debt: ").append(Money.format(plan.monthlyIncomeAvailable())).append('\n');
        prompt.append("Extra capacity: ").append(Money.format(plan.extraCapacity())).append('\n');
        prompt.append("Projected months until debt free: ").append(plan.projectedMonths()).append('\n');
        prompt.append("Total interest: ").append(Money.format(plan.totalInterest())).append('\n');
        for (DebtAnalysis debt : plan.debts()) {
            prompt.append("- #").append(debt.priority()).append(' ').append(debt.name())
                    .append(": principal ").append(Money.format(debt.principal()))
                    .append(", rate ").append(Money.formatPercent(debt.annualRate()))
                    .append(", payment ").append(Money.format(debt.minimumPayment()))
                    .append(", months ").append(debt.monthsToPayoff())
                    .append(", interest ").append(Money.format(debt.totalInterest()))
                    .append(debt.highCost() ? ", HIGH COST" : "")
                    .append('\n');
        }
        appendList(prompt, "Recommendations", plan.recommendations());
        prompt.append("Explain why this order makes sense and how to stay motivated until the last debt is paid.");
        return prompt.toString();
    }

    public static String portfolio(PortfolioRecommendation recommendation) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Investment portfolio for a ").append(label(recommendation.plan().riskProfile())).append(" profile\n");
        prompt.append("Amount: ").append(Money.format(recommendation.plan().totalAmount())).append('\n');
        prompt.append("Term: ").append(recommendation.plan().termMonths()).append(" months\n");
        prompt.append("Blended expected return: ").append(Money.formatPercent(recommendation.blendedAnnualReturn())).append('\n');
        prompt.append("Projected final value: ").append(Money.format(recommendation.projection().finalValue())).append('\n');
        prompt.append("Projected gain: ").append(Money.format(recommendation.projection().gain())).append('\n');
        for (InstrumentAllocation allocation : recommendation.allocations()) {
            prompt.append("- ").append(allocation.instrument().name())
                    .append(": ").append(Money.formatPercent(allocation.instrument().weightPercent()))
                    .append(" = ").append(Money.format(allocation.amount()))
                    .append(", expected ").append(Money.formatPercent(allocation.instrument().expectedAnnualReturn()))
                    .append(", risk ").append(label(allocation.instrument().riskLevel()))
                    .append('\n');
        }
        prompt.append("Describe the role of each instrument and the main risk of this portfolio.");
        return prompt.toString();
    }

    private static void appendList(StringBuilder prompt, String title, java.util.List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        prompt.append(title).append(":\n");
        for (String item : items) {
            prompt.append("* ").append(item).append('\n');
        }
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
