package com.raisket.advisor.planning;

import com.raisket.advisor.model.AmortizationResult;
import com.raisket.advisor.model.Debt;
import com.raisket.advisor.model.DebtAnalysis;
import com.raisket.advisor.model.DebtPlan;
import com.raisket.advisor.model.Strategy;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds a payoff plan for a set of debts. The strategy only decides the priority order; every debt is
 * simulated at its own minimum payment.
 */
@Component
public class DebtStrategyEngine {

    private static final Logger log = LoggerFactory.getLogger(DebtStrategyEngine.class);

    /** Debts above this annual rate are flagged as high-cost. */
    public static final BigDecimal HIGH_COST_RATE = BigDecimal.valueOf(40);

    private final AmortizationSimulator simulator;

    public DebtStrategyEngine(AmortizationSimulator simulator) {
        this.simulator = simulator;
    }

    public DebtPlan analyze(List<Debt> debts, BigDecimal monthlyIncomeAvailable, Strategy strategy) {
        PlanningInputValidator.validateDebtRequest(debts, monthlyIncomeAvailable).throwIfInvalid();
        if (strategy == null) {
            throw new InvalidInputException(List.of("strategy must be provided"));
        }

        BigDecimal totalMinimum = debts.stream()
                .map(Debt::minimumPayment)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalMinimum.compareTo(monthlyIncomeAvailable) > 0) {
            throw new InsufficientIncomeException(Money.round(totalMinimum), Money.round(monthlyIncomeAvailable));
        }

        List<Simulated> simulated = new ArrayList<>(debts.size());
        for (Debt debt : debts) {
            try {
                simulated.add(new Simulated(debt, simulator.simulate(debt.principal(), debt.annualRate(), debt.minimumPayment())));
            } catch (PaymentTooLowException ex) {
                throw new DebtUnpayableException(debt.name(), ex);
            }
        }

        // List.sort is stable, so equal keys keep their input order
        simulated.sort(ordering(strategy));

        List<DebtAnalysis> analyses = new ArrayList<>(simulated.size());
        for (int i = 0; i < simulated.size(); i++) {
            analyses.add(toAnalysis(simulated.get(i), i + 1));
        }

        BigDecimal totalPrincipal = debts.stream().map(Debt::principal).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalInterest = analyses.stream().map(DebtAnalysis::totalInterest).reduce(BigDecimal.ZERO, BigDecimal::add);
        int projectedMonths = analyses.stream().mapToInt(DebtAnalysis::monthsToPayoff).max().orElse(0);
        BigDecimal extraCapacity = monthlyIncomeAvailable.subtract(totalMinimum);
        boolean allPaidOff = analyses.stream().allMatch(DebtAnalysis::paidOff);
        List<String> highCostDebts = analyses.stream()
                .filter(DebtAnalysis::highCost)
                .map(DebtAnalysis::name)
                .toList();
        List<String> payoffOrder = analyses.stream()
                .map(analysis -> analysis.priority() + ". " + analysis.name()
                        + " (" + Money.formatPercent(analysis.annualRate()) + ", " + Money.format(analysis.principal()) + ")")
                .toList();

        log.debug("Debt plan built: strategy={} debts={} projectedMonths={}", strategy, analyses.size(), projectedMonths);

        return new DebtPlan(
                strategy,
                analyses,
                Money.round(totalPrincipal),
                Money.round(totalMinimum),
                Money.round(totalInterest),
                projectedMonths,
                Money.round(monthlyIncomeAvailable),
                Money.round(extraCapacity),
                payoffOrder,
                highCostDebts,
                allPaidOff,
                buildRecommendations(analyses, extraCapacity)
        );
    }

    private static Comparator<Simulated> ordering(Strategy strategy) {
        return switch (strategy) {
            case AVALANCHE -> Comparator.comparing((Simulated s) -> s.debt().annualRate()).reversed();
            case SNOWBALL -> Comparator.comparing((Simulated s) -> s.debt().principal());
        };
    }

    private DebtAnalysis toAnalysis(Simulated simulated, int priority) {
        Debt debt = simulated.debt();
        AmortizationResult result = simulated.result();
        BigDecimal monthlyInterest = Money.round(debt.principal().multiply(Money.monthlyRate(debt.annualRate())));
        return new DebtAnalysis(
                debt.name(),
                Money.round(debt.principal()),
                debt.annualRate(),
                monthlyInterest,
                Money.round(debt.minimumPayment()),
                recommendedPayment(debt),
                result.months(),
                result.totalInterest(),
                result.totalPaid(),
                priority,
                result.paidOff(),
                debt.annualRate().compareTo(HIGH_COST_RATE) > 0
        );
    }

    // with a target term the recommendation is whichever is larger: the minimum or the term installment
    private BigDecimal recommendedPayment(Debt debt) {
        BigDecimal minimum = Money.round(debt.minimumPayment());
        if (debt.termMonths() == null) {
            return minimum;
        }
        BigDecimal installment = simulator.installmentFor(debt.principal(), debt.annualRate(), debt.termMonths());
        return installment.max(minimum);
    }

    private static List<String> buildRecommendations(List<DebtAnalysis> analyses, BigDecimal extraCapacity) {
        List<String> recommendations = new ArrayList<>();
        DebtAnalysis first = analyses.get(0);
        if (extraCapacity.signum() > 0) {
            recommendations.add("Put the extra " + Money.format(extraCapacity) + " per month toward " + first.name()
                    + " while paying the minimum on the rest; once it is cleared, roll its payment into the next debt.");
        } else {
            recommendations.add("All available income goes to minimum payments; there is no margin for unexpected expenses.");
        }
        for (DebtAnalysis analysis : analyses) {
            if (analysis.highCost()) {
                recommendations.add(analysis.name() + " charges " + Money.formatPercent(analysis.annualRate())
                        + " a year. Look into refinancing or consolidating it at a lower rate.");
            }
            if (!analysis.paidOff()) {
                recommendations.add(analysis.name() + " is not paid off within " + AmortizationSimulator.MAX_MONTHS
                        + " months at the minimum payment. Increase its monthly payment.");
            }
        }
        return recommendations;
    }

    private record Simulated(Debt debt, AmortizationResult result) {
    }
}
