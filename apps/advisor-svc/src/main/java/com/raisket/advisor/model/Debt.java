package com.raisket.advisor.model;

import java.math.BigDecimal;

/**
 * A single outstanding debt. {@code annualRate} is a percentage (24 means 24% per year) and
 * {@code termMonths} is optional.
 */
public record Debt(
        String name,
        BigDecimal principal,
        BigDecimal annualRate,
        BigDecimal minimumPayment,
        Integer termMonths
) {

    public Debt(String name, BigDecimal principal, BigDecimal annualRate, BigDecimal minimumPayment) {
        this(name, principal, annualRate, minimumPayment, null);
    }
}
