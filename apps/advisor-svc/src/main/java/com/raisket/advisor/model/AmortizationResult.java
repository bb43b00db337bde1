package com.raisket.advisor.model;

import java.math.BigDecimal;

/**
 * Outcome of simulating one debt at a fixed payment. When the month cap is reached before the balance
 * clears, {@code nonConvergent} is set and {@code remainingBalance} holds what is still owed.
 */
public record AmortizationResult(
        int months,
        BigDecimal totalInterest,
        BigDecimal totalPaid,
        BigDecimal remainingBalance,
        boolean nonConvergent
) {

    public boolean paidOff() {
        return !nonConvergent;
    }
}
