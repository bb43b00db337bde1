package com.raisket.advisor.planning;

import com.raisket.advisor.model.InstrumentAllocation;
import com.raisket.advisor.model.InvestmentPlan;
import com.raisket.advisor.model.PortfolioRecommendation;
import com.raisket.advisor.model.Projection;
import com.raisket.advisor.model.RiskProfile;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Scales the template for the plan's risk profile to the amount invested and projects it at the blended
 * return.
 */
@Component
public class PortfolioBuilder {

    private static final int SHORT_HORIZON_MONTHS = 12;

    private final CompoundProjector projector;

    public PortfolioBuilder(CompoundProjector projector) {
        this.projector = projector;
    }

    public PortfolioRecommendation build(InvestmentPlan plan) {
        PlanningInputValidator.validateInvestmentPlan(plan).throwIfInvalid();

        PortfolioTemplates.Template template = PortfolioTemplates.forProfile(plan.riskProfile());
        List<InstrumentAllocation> allocations = template.instruments().stream()
                .map(instrument -> new InstrumentAllocation(
                        instrument,
                        Money.round(Money.percentOf(plan.totalAmount(), instrument.weightPercent()))))
                .toList();

        Projection projection = projector.project(
                plan.totalAmount(),
                template.blendedAnnualReturn(),
                plan.termMonths(),
                BigDecimal.ZERO);

        return new PortfolioRecommendation(
                plan,
                allocations,
                template.blendedAnnualReturn(),
                projection,
                plan.riskProfile().overallRisk(),
                buildNotes(plan, template.blendedAnnualReturn())
        );
    }

    private static List<String> buildNotes(InvestmentPlan plan, BigDecimal blendedReturn) {
        List<String> notes = new ArrayList<>();
        notes.add("Expected returns are annual estimates (" + Money.formatPercent(blendedReturn)
                + " blended) and are not guaranteed.");
        if (plan.termMonths() < SHORT_HORIZON_MONTHS && plan.riskProfile() != RiskProfile.CONSERVATIVE) {
            notes.add("A horizon under 12 months is short for equity exposure; consider a more conservative mix.");
        }
        return notes;
    }
}
