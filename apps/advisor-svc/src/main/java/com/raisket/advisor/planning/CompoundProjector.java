package com.raisket.advisor.planning;

import com.raisket.advisor.model.Projection;
import com.raisket.advisor.model.ProjectionYear;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Future value of a lump sum plus a stream of end-of-month contributions, compounded monthly.
 */
@Component
public class CompoundProjector {

    public Projection project(BigDecimal principal, BigDecimal annualRatePercent, int months, BigDecimal monthlyContribution) {
        PlanningInputValidator.validateProjection(principal, annualRatePercent, months, monthlyContribution).throwIfInvalid();

        BigDecimal monthlyRate = Money.monthlyRate(annualRatePercent);
        BigDecimal periods = BigDecimal.valueOf(months);
        BigDecimal finalValue;
        if (monthlyRate.signum() == 0) {
            finalValue = principal.add(monthlyContribution.multiply(periods));
        } else {
            BigDecimal growth = BigDecimal.ONE.add(monthlyRate).pow(months, Money.CONTEXT);
            BigDecimal principalFuture = principal.multiply(growth);
            BigDecimal contributionFuture = BigDecimal.ZERO;
            if (monthlyContribution.signum() > 0) {
                BigDecimal annuityFactor = growth.subtract(BigDecimal.ONE).divide(monthlyRate, Money.CONTEXT);
                contributionFuture = monthlyContribution.multiply(annuityFactor);
            }
            finalValue = principalFuture.add(contributionFuture);
        }
        BigDecimal totalContributed = principal.add(monthlyContribution.multiply(periods));

        return new Projection(
                Money.round(principal),
                annualRatePercent,
                months,
                Money.round(monthlyContribution),
                Money.round(finalValue),
                Money.round(totalContributed),
                Money.round(finalValue.subtract(totalContributed))
        );
    }

    /**
     * Year-by-year balance starting with year 0 (the initial deposit). Interest accrues on the opening
     * balance each month and the contribution lands at month end, so the last row agrees with
     * {@link #project} for {@code 12 * years} months.
     */
    public List<ProjectionYear> schedule(BigDecimal principal, BigDecimal annualRatePercent, int years, BigDecimal monthlyContribution) {
        PlanningInputValidator.validateSchedule(principal, annualRatePercent, years, monthlyContribution).throwIfInvalid();

        BigDecimal monthlyRate = Money.monthlyRate(annualRatePercent);
        BigDecimal balance = principal;
        BigDecimal contributed = principal;
        BigDecimal interest = BigDecimal.ZERO;

        List<ProjectionYear> rows = new ArrayList<>(years + 1);
        rows.add(new ProjectionYear(0, Money.round(contributed), Money.ZERO, Money.round(balance)));
        for (int year = 1; year <= years; year++) {
            for (int month = 0; month < 12; month++) {
                BigDecimal earned = balance.multiply(monthlyRate, Money.CONTEXT);
                interest = interest.add(earned);
                balance = balance.add(earned).add(monthlyContribution);
                contributed = contributed.add(monthlyContribution);
            }
            rows.add(new ProjectionYear(year, Money.round(contributed), Money.round(interest), Money.round(balance)));
        }
        return rows;
    }
}
