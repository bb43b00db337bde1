package com.raisket.advisor.service;

import com.raisket.advisor.ai.NarrativePrompts;
import com.raisket.advisor.ai.NarrativeService;
import com.raisket.advisor.model.Advice;
import com.raisket.advisor.model.BudgetAnalysis;
import com.raisket.advisor.model.Debt;
import com.raisket.advisor.model.DebtPlan;
import com.raisket.advisor.model.InvestmentPlan;
import com.raisket.advisor.model.MonthlyBudget;
import com.raisket.advisor.model.PortfolioRecommendation;
import com.raisket.advisor.model.Projection;
import com.raisket.advisor.model.ProjectionYear;
import com.raisket.advisor.model.Strategy;
import com.raisket.advisor.planning.BudgetAnalyzer;
import com.raisket.advisor.planning.CompoundProjector;
import com.raisket.advisor.planning.DebtStrategyEngine;
import com.raisket.advisor.planning.PortfolioBuilder;
import com.raisket.advisor.security.RequestContextHolder;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the three analyses. The numeric result is computed first; the narrative is optional and
 * its failure never affects that result.
 */
@Service
public class AdvisoryService {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryService.class);

    private final BudgetAnalyzer budgetAnalyzer;
    private final DebtStrategyEngine debtStrategyEngine;
    private final PortfolioBuilder portfolioBuilder;
    private final CompoundProjector compoundProjector;
    private final NarrativeService narrativeService;

    public AdvisoryService(
            BudgetAnalyzer budgetAnalyzer,
            DebtStrategyEngine debtStrategyEngine,
            PortfolioBuilder portfolioBuilder,
            CompoundProjector compoundProjector,
            NarrativeService narrativeService) {
        this.budgetAnalyzer = budgetAnalyzer;
        this.debtStrategyEngine = debtStrategyEngine;
        this.portfolioBuilder = portfolioBuilder;
        this.compoundProjector = compoundProjector;
        this.narrativeService = narrativeService;
    }

    public Advice<BudgetAnalysis> analyzeBudget(MonthlyBudget budget, boolean withNarrative) {
        BudgetAnalysis analysis = budgetAnalyzer.analyze(budget);
        log.info("Budget analysis completed: status={} savingsRate={}", analysis.overallStatus(), analysis.savingsRatePercent());
        return advise(analysis, withNarrative, NarrativePrompts::budget);
    }

    public Advice<DebtPlan> planDebts(List<Debt> debts, BigDecimal monthlyIncomeAvailable, Strategy strategy, boolean withNarrative) {
        DebtPlan plan = debtStrategyEngine.analyze(debts, monthlyIncomeAvailable, strategy);
        log.info("Debt plan completed: strategy={} debts={} projectedMonths={} allPaidOff={}",
                plan.strategy(), plan.debts().size(), plan.projectedMonths(), plan.allPaidOff());
        return advise(plan, withNarrative, NarrativePrompts::debts);
    }

    public Advice<PortfolioRecommendation> recommendPortfolio(InvestmentPlan plan, boolean withNarrative) {
        PortfolioRecommendation recommendation = portfolioBuilder.build(plan);
        log.info("Portfolio recommendation completed: profile={} blendedReturn={}",
                plan.riskProfile(), recommendation.blendedAnnualReturn());
        return advise(recommendation, withNarrative, NarrativePrompts::portfolio);
    }

    public Projection project(BigDecimal principal, BigDecimal annualRatePercent, int months, BigDecimal monthlyContribution) {
        return compoundProjector.project(principal, annualRatePercent, months, monthlyContribution);
    }

    public List<ProjectionYear> schedule(BigDecimal principal, BigDecimal annualRatePercent, int years, BigDecimal monthlyContribution) {
        return compoundProjector.schedule(principal, annualRatePercent, years, monthlyContribution);
    }

    private <T> Advice<T> advise(T analysis, boolean withNarrative, Function<T, String> promptBuilder) {
        String traceId = currentTraceId();
        if (!withNarrative) {
            return new Advice<>(analysis, null, false, traceId);
        }
        try {
            NarrativeService.Narrative narrative = narrativeService.narrate(promptBuilder.apply(analysis));
            return new Advice<>(analysis, narrative.text(), narrative.generated(), traceId);
        } catch (Exception ex) {
            log.warn("Narrative: unexpected failure traceId {}, using fallback", traceId, ex);
            return new Advice<>(analysis, NarrativeService.FALLBACK_NARRATIVE, false, traceId);
        }
    }

    private static String currentTraceId() {
        return RequestContextHolder.traceId().orElseGet(() -> UUID.randomUUID().toString());
    }
}
