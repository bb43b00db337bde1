package com.raisket.advisor.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.raisket.advisor.model.BudgetAnalysis;
import com.raisket.advisor.model.MonthlyBudget;
import com.raisket.advisor.planning.BudgetAnalyzer;
import com.raisket.advisor.planning.RuleAllocator;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class NarrativePromptsTest {

    @Test
    void budgetPromptIsDeterministicAndCarriesFigures() {
        BudgetAnalysis analysis = new BudgetAnalyzer(new RuleAllocator()).analyze(new MonthlyBudget(
                new BigDecimal("20000"), new BigDecimal("8000"), new BigDecimal("5000"), BigDecimal.ZERO, BigDecimal.ZERO));

        String prompt = NarrativePrompts.budget(analysis);

        assertThat(prompt).isEqualTo(NarrativePrompts.budget(analysis));
        assertThat(prompt).contains("$20,000.00").contains("$7,000.00");
    }
}
