package com.raisket.advisor.controller;

import com.raisket.advisor.controller.dto.BudgetAnalysisRequestDto;
import com.raisket.advisor.controller.dto.BudgetAnalysisResponseDto;
import com.raisket.advisor.controller.dto.DebtPlanRequestDto;
import com.raisket.advisor.controller.dto.DebtPlanResponseDto;
import com.raisket.advisor.controller.dto.InvestmentPlanRequestDto;
import com.raisket.advisor.controller.dto.PortfolioResponseDto;
import com.raisket.advisor.controller.dto.ProjectionRequestDto;
import com.raisket.advisor.controller.dto.ProjectionResponseDto;
import com.raisket.advisor.model.Advice;
import com.raisket.advisor.model.BudgetAnalysis;
import com.raisket.advisor.model.DebtPlan;
import com.raisket.advisor.model.PortfolioRecommendation;
import com.raisket.advisor.model.Projection;
import com.raisket.advisor.model.ProjectionYear;
import com.raisket.advisor.model.Strategy;
import com.raisket.advisor.planning.PlanningInputValidator;
import com.raisket.advisor.security.RequestContextHolder;
import com.raisket.advisor.service.AdvisoryService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/planning")
@Validated
public class PlanningController {

    private final AdvisoryService advisoryService;

    public PlanningController(AdvisoryService advisoryService) {
        this.advisoryService = advisoryService;
    }

    @PostMapping("/budget")
    public ResponseEntity<BudgetAnalysisResponseDto> analyzeBudget(
            @Valid @RequestBody BudgetAnalysisRequestDto request,
            @RequestParam(value = "narrative", required = false, defaultValue = "false") boolean narrative
    ) {
        Advice<BudgetAnalysis> advice = advisoryService.analyzeBudget(request.toBudget(), narrative);
        return ResponseEntity.ok(mapBudget(advice));
    }

    @PostMapping("/debts")
    public ResponseEntity<DebtPlanResponseDto> planDebts(
            @Valid @RequestBody DebtPlanRequestDto request,
            @RequestParam(value = "narrative", required = false, defaultValue = "false") boolean narrative
    ) {
        Advice<DebtPlan> advice = advisoryService.planDebts(
                request.toDebts(),
                request.monthlyIncomeAvailable(),
                Strategy.parse(request.strategy()),
                narrative);
        return ResponseEntity.ok(mapDebtPlan(advice));
    }

    @PostMapping("/investments")
    public ResponseEntity<PortfolioResponseDto> recommendPortfolio(
            @Valid @RequestBody InvestmentPlanRequestDto request,
            @RequestParam(value = "narrative", required = false, defaultValue = "false") boolean narrative
    ) {
        Advice<PortfolioRecommendation> advice = advisoryService.recommendPortfolio(request.toPlan(), narrative);
        return ResponseEntity.ok(mapPortfolio(advice));
    }

    @PostMapping("/projections")
    public ResponseEntity<ProjectionResponseDto> project(@Valid @RequestBody ProjectionRequestDto request) {
        Projection projection = advisoryService.project(
                request.principal(),
                request.annualRate(),
                request.months(),
                request.monthlyContributionOrZero());
        List<ProjectionYear> yearly = List.of();
        int months = request.months();
        if (months % 12 == 0 && months / 12 <= PlanningInputValidator.MAX_SCHEDULE_YEARS) {
            yearly = advisoryService.schedule(request.principal(), request.annualRate(), months / 12, request.monthlyContributionOrZero());
        }
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(mapProjection(projection, yearly, traceId));
    }

    private BudgetAnalysisResponseDto mapBudget(Advice<BudgetAnalysis> advice) {
        BudgetAnalysis analysis = advice.analysis();
        return new BudgetAnalysisResponseDto(
                analysis.income(),
                analysis.totalExpenses(),
                analysis.disposable(),
                analysis.savingsRatePercent(),
                analysis.categories().stream()
                        .map(category -> new BudgetAnalysisResponseDto.Category(
                                category.name(),
                                category.actualAmount(),
                                category.recommendedAmount(),
                                category.actualPercent(),
                                category.recommendedPercent(),
                                category.delta(),
                                label(category.status())))
                        .toList(),
                label(analysis.overallStatus()),
                analysis.recommendations(),
                advice.narrative(),
                advice.narrativeGenerated(),
                advice.traceId()
        );
    }

    private DebtPlanResponseDto mapDebtPlan(Advice<DebtPlan> advice) {
        DebtPlan plan = advice.analysis();
        return new DebtPlanResponseDto(
                label(plan.strategy()),
                plan.debts().stream()
                        .map(debt -> new DebtPlanResponseDto.DebtAnalysis(
                                debt.name(),
                                debt.principal(),
                                debt.annualRate(),
                                debt.monthlyInterest(),
                                debt.minimumPayment(),
                                debt.recommendedPayment(),
                                debt.monthsToPayoff(),
                                debt.totalInterest(),
                                debt.totalPaid(),
                                debt.priority(),
                                debt.paidOff(),
                                debt.highCost()))
                        .toList(),
                plan.totalPrincipal(),
                plan.totalMinimumPayment(),
                plan.totalInterest(),
                plan.projectedMonths(),
                plan.monthlyIncomeAvailable(),
                plan.extraCapacity(),
                plan.payoffOrder(),
                plan.highCostDebts(),
                plan.allPaidOff(),
                plan.recommendations(),
                advice.narrative(),
                advice.narrativeGenerated(),
                advice.traceId()
        );
    }

    private PortfolioResponseDto mapPortfolio(Advice<PortfolioRecommendation> advice) {
        PortfolioRecommendation recommendation = advice.analysis();
        return new PortfolioResponseDto(
                label(recommendation.plan().riskProfile()),
                recommendation.plan().totalAmount(),
                recommendation.plan().termMonths(),
                recommendation.allocations().stream()
                        .map(allocation -> new PortfolioResponseDto.InstrumentAllocation(
                                allocation.instrument().name(),
                                label(allocation.instrument().assetClass()),
                                allocation.instrument().weightPercent(),
                                allocation.instrument().expectedAnnualReturn(),
                                label(allocation.instrument().riskLevel()),
                                label(allocation.instrument().liquidity()),
                                allocation.amount()))
                        .toList(),
                recommendation.blendedAnnualReturn(),
                mapProjection(recommendation.projection(), List.of(), null),
                label(recommendation.overallRisk()),
                recommendation.notes(),
                advice.narrative(),
                advice.narrativeGenerated(),
                advice.traceId()
        );
    }

    private ProjectionResponseDto mapProjection(Projection projection, List<ProjectionYear> yearly, String traceId) {
        return new ProjectionResponseDto(
                projection.principal(),
                projection.annualRatePercent(),
                projection.months(),
                projection.monthlyContribution(),
                projection.finalValue(),
                projection.totalContributed(),
                projection.gain(),
                yearly.stream()
                        .map(row -> new ProjectionResponseDto.YearRow(row.year(), row.contributed(), row.interest(), row.balance()))
                        .toList(),
                traceId
        );
    }

    private static String label(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
