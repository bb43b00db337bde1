package com.raisket.advisor.model;

import java.math.BigDecimal;

public record DebtAnalysis(
        String name,
        BigDecimal principal,
        BigDecimal annualRate,
        BigDecimal monthlyInterest,
        BigDecimal minimumPayment,
        BigDecimal recommendedPayment,
        int monthsToPayoff,
        BigDecimal totalInterest,
        BigDecimal totalPaid,
        int priority,
        boolean paidOff,
        boolean highCost
) {
}
