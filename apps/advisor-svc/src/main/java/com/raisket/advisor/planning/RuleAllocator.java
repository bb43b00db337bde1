package com.raisket.advisor.planning;

import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Splits a monthly income with the 50/30/20 rule.
 */
@Component
public class RuleAllocator {

    public static final BigDecimal NECESSITIES_PERCENT = BigDecimal.valueOf(50);
    public static final BigDecimal WANTS_PERCENT = BigDecimal.valueOf(30);
    public static final BigDecimal SAVINGS_PERCENT = BigDecimal.valueOf(20);

    public Allocation allocate(BigDecimal income) {
        PlanningInputValidator.validateIncome(income).throwIfInvalid();
        return new Allocation(
                Money.round(Money.percentOf(income, NECESSITIES_PERCENT)),
                Money.round(Money.percentOf(income, WANTS_PERCENT)),
                Money.round(Money.percentOf(income, SAVINGS_PERCENT))
        );
    }

    public record Allocation(BigDecimal necessities, BigDecimal wants, BigDecimal savings) {

        public BigDecimal total() {
            return necessities.add(wants).add(savings);
        }
    }
}
