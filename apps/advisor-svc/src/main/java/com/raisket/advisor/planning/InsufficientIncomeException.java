package com.raisket.advisor.planning;

import java.math.BigDecimal;

public class InsufficientIncomeException extends PlanningException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientIncomeException(BigDecimal required, BigDecimal available) {
        super(PlanningErrorCode.INSUFFICIENT_INCOME,
                "Minimum payments of " + Money.format(required) + " exceed the available income of " + Money.format(available));
        this.required = required;
        this.available = available;
    }

    public BigDecimal required() {
        return required;
    }

    public BigDecimal available() {
        return available;
    }
}
