package com.raisket.advisor.planning;

import java.math.BigDecimal;

/**
 * The payment does not cover the interest accruing in a month, so the balance can never shrink.
 */
public class PaymentTooLowException extends PlanningException {

    private final BigDecimal payment;
    private final BigDecimal monthlyInterest;

    public PaymentTooLowException(BigDecimal payment, BigDecimal monthlyInterest) {
        super(PlanningErrorCode.PAYMENT_TOO_LOW,
                "Payment " + Money.format(payment) + " does not cover monthly interest of " + Money.format(monthlyInterest));
        this.payment = payment;
        this.monthlyInterest = monthlyInterest;
    }

    public BigDecimal payment() {
        return payment;
    }

    public BigDecimal monthlyInterest() {
        return monthlyInterest;
    }
}
