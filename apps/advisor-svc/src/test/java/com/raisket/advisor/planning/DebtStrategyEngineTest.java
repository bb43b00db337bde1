package com.raisket.advisor.planning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.raisket.advisor.model.Debt;
import com.raisket.advisor.model.DebtAnalysis;
import com.raisket.advisor.model.DebtPlan;
import com.raisket.advisor.model.Strategy;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class DebtStrategyEngineTest {

    private final DebtStrategyEngine engine = new DebtStrategyEngine(new AmortizationSimulator());

    @Test
    void avalanchePrioritisesHighestRate() {
        List<Debt> debts = List.of(
                debt("Car loan", "20000", "12", "500"),
                debt("Credit card", "5000", "36", "300"));

        DebtPlan plan = engine.analyze(debts, new BigDecimal("1000"), Strategy.parse("avalancha"));

        assertThat(plan.strategy()).isEqualTo(Strategy.AVALANCHE);
        assertThat(plan.debts()).extracting(DebtAnalysis::name).containsExactly("Credit card", "Car loan");
        assertThat(plan.debts()).extracting(DebtAnalysis::priority).containsExactly(1, 2);
        assertThat(plan.payoffOrder().get(0)).isEqualTo("1. Credit card (36.00%, $5,000.00)");
        assertThat(plan.totalPrincipal()).isEqualByComparingTo("25000");
        assertThat(plan.totalMinimumPayment()).isEqualByComparingTo("800");
        assertThat(plan.extraCapacity()).isEqualByComparingTo("200.00");
        assertThat(plan.allPaidOff()).isTrue();
        assertThat(plan.recommendations().get(0)).contains("$200.00").contains("Credit card");

        DebtAnalysis card = plan.debts().get(0);
        assertThat(card.monthlyInterest()).isEqualByComparingTo("150.00");
        assertThat(plan.projectedMonths()).isEqualTo(plan.debts().stream().mapToInt(DebtAnalysis::monthsToPayoff).max().orElseThrow());
    }

    @Test
    void snowballPrioritisesSmallestBalanceAndFlagsHighCost() {
        List<Debt> debts = List.of(
                debt("Department store", "8000", "45", "400"),
                debt("Phone plan", "1500", "20", "100"));

        DebtPlan plan = engine.analyze(debts, new BigDecimal("600"), Strategy.SNOWBALL);

        assertThat(plan.debts()).extracting(DebtAnalysis::name).containsExactly("Phone plan", "Department store");
        assertThat(plan.highCostDebts()).containsExactly("Department store");
        assertThat(plan.debts().get(1).highCost()).isTrue();
        assertThat(plan.recommendations()).anyMatch(r -> r.startsWith("Department store charges 45.00%"));
    }

    @Test
    void equalKeysKeepInputOrder() {
        List<Debt> debts = List.of(
                debt("First", "1000", "24", "100"),
                debt("Second", "2000", "24", "100"));

        DebtPlan plan = engine.analyze(debts, new BigDecimal("500"), Strategy.AVALANCHE);

        assertThat(plan.debts()).extracting(DebtAnalysis::name).containsExactly("First", "Second");
    }

    @Test
    void recommendedPaymentCoversTargetTerm() {
        Debt loan = new Debt("Personal loan", new BigDecimal("10000"), new BigDecimal("12"), new BigDecimal("500"), 12);

        DebtPlan plan = engine.analyze(List.of(loan), new BigDecimal("1000"), Strategy.AVALANCHE);

        assertThat(plan.debts().get(0).recommendedPayment()).isEqualByComparingTo("888.49");
        assertThat(plan.debts().get(0).minimumPayment()).isEqualByComparingTo("500.00");
    }

    @Test
    void noExtraCapacityWarnsAboutMargin() {
        DebtPlan plan = engine.analyze(
                List.of(debt("Card", "1000", "24", "200")), new BigDecimal("200"), Strategy.AVALANCHE);

        assertThat(plan.extraCapacity()).isEqualByComparingTo("0");
        assertThat(plan.recommendations().get(0)).startsWith("All available income goes to minimum payments");
    }

    @Test
    void minimumsAboveIncomeAreRejected() {
        List<Debt> debts = List.of(
                debt("Card", "5000", "30", "400"),
                debt("Loan", "3000", "15", "100"));

        assertThatThrownBy(() -> engine.analyze(debts, new BigDecimal("400"), Strategy.AVALANCHE))
                .isInstanceOf(InsufficientIncomeException.class)
                .satisfies(ex -> {
                    InsufficientIncomeException insufficient = (InsufficientIncomeException) ex;
                    assertThat(insufficient.required()).isEqualByComparingTo("500.00");
                    assertThat(insufficient.available()).isEqualByComparingTo("400.00");
                    assertThat(insufficient.code()).isEqualTo(PlanningErrorCode.INSUFFICIENT_INCOME);
                });
    }

    @Test
    void debtThatCannotBeRetiredIsNamed() {
        List<Debt> debts = List.of(debt("Credit card", "10000", "24", "100"));

        assertThatThrownBy(() -> engine.analyze(debts, new BigDecimal("1000"), Strategy.AVALANCHE))
                .isInstanceOf(DebtUnpayableException.class)
                .hasCauseInstanceOf(PaymentTooLowException.class)
                .satisfies(ex -> assertThat(((DebtUnpayableException) ex).debtName()).isEqualTo("Credit card"));
    }

    @Test
    void missingStrategyIsInvalidInput() {
        assertThatThrownBy(() -> engine.analyze(List.of(debt("Card", "1000", "24", "100")), new BigDecimal("500"), null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void emptyDebtListIsInvalidInput() {
        assertThatThrownBy(() -> engine.analyze(List.of(), new BigDecimal("500"), Strategy.SNOWBALL))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("at least one debt");
    }

    @Test
    void parsesStrategyLabels() {
        assertThat(Strategy.parse("Bola de nieve")).isEqualTo(Strategy.SNOWBALL);
        assertThat(Strategy.parse("snowball")).isEqualTo(Strategy.SNOWBALL);
        assertThat(Strategy.parse("AVALANCHE")).isEqualTo(Strategy.AVALANCHE);
        assertThatThrownBy(() -> Strategy.parse("random")).isInstanceOf(IllegalArgumentException.class);
    }

    private static Debt debt(String name, String principal, String rate, String minimum) {
        return new Debt(name, new BigDecimal(principal), new BigDecimal(rate), new BigDecimal(minimum));
    }
}
