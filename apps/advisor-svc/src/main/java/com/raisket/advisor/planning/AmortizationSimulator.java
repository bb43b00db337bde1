package com.raisket.advisor.planning;

import com.raisket.advisor.model.AmortizationResult;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Month-by-month payoff of a single debt at a fixed payment.
 */
@Component
public class AmortizationSimulator {

    private static final Logger log = LoggerFactory.getLogger(AmortizationSimulator.class);

    /** 50 years. A debt still open after this many months is reported as non-convergent. */
    public static final int MAX_MONTHS = 600;

    /**
     * Simulates the payoff of {@code principal} at {@code annualRatePercent} with a constant
     * {@code monthlyPayment}.
     *
     * @throws PaymentTooLowException if in any month the payment does not exceed the interest accrued
     * @throws InvalidInputException if an argument violates its constraint
     */
    public AmortizationResult simulate(BigDecimal principal, BigDecimal annualRatePercent, BigDecimal monthlyPayment) {
        PlanningInputValidator.validateAmortization(principal, annualRatePercent, monthlyPayment).throwIfInvalid();

        BigDecimal monthlyRate = Money.monthlyRate(annualRatePercent);
        BigDecimal balance = principal;
        BigDecimal totalInterest = BigDecimal.ZERO;
        int months = 0;

        while (balance.signum() > 0 && months < MAX_MONTHS) {
            BigDecimal interest = balance.multiply(monthlyRate, Money.CONTEXT);
            BigDecimal principalPortion = monthlyPayment.subtract(interest);
            if (principalPortion.signum() <= 0) {
                throw new PaymentTooLowException(monthlyPayment, Money.round(interest));
            }
            totalInterest = totalInterest.add(interest);
            balance = balance.subtract(principalPortion);
            if (balance.signum() < 0) {
                balance = BigDecimal.ZERO;
            }
            months++;
        }

        boolean nonConvergent = balance.signum() > 0;
        if (nonConvergent) {
            log.debug("Amortization hit the {}-month cap with {} still owed", MAX_MONTHS, Money.round(balance));
        }
        BigDecimal totalPaid = principal.subtract(balance).add(totalInterest);
        return new AmortizationResult(
                months,
                Money.round(totalInterest),
                Money.round(totalPaid),
                Money.round(balance),
                nonConvergent
        );
    }

    /**
     * Fixed monthly installment that retires {@code principal} in exactly {@code termMonths} payments:
     * {@code M = P·r(1+r)^n / ((1+r)^n − 1)}, or {@code P / n} at a zero rate.
     */
    public BigDecimal installmentFor(BigDecimal principal, BigDecimal annualRatePercent, int termMonths) {
        PlanningInputValidator.validateInstallment(principal, annualRatePercent, termMonths).throwIfInvalid();

        BigDecimal monthlyRate = Money.monthlyRate(annualRatePercent);
        if (monthlyRate.signum() == 0) {
            return Money.round(principal.divide(BigDecimal.valueOf(termMonths), Money.CONTEXT));
        }
        BigDecimal growth = BigDecimal.ONE.add(monthlyRate).pow(termMonths, Money.CONTEXT);
        BigDecimal numerator = principal.multiply(monthlyRate).multiply(growth);
        return Money.round(numerator.divide(growth.subtract(BigDecimal.ONE), Money.CONTEXT));
    }
}
