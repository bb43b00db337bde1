package com.raisket.advisor.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.raisket.advisor.ai.NarrativeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
        // nothing listens on the discard port, so a narrative call always falls back
        "raisket.ai.endpoint=http://127.0.0.1:9/v1/responses",
        "raisket.ai.timeout-ms=2000"
})
@AutoConfigureMockMvc
class PlanningControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void analyzesBudget() throws Exception {
        String body = """
                {"monthly_income": 20000, "fixed_expenses": 8000, "variable_expenses": 5000, "current_savings": 1000}
                """;
        mockMvc.perform(post("/planning/budget")
                        .header("X-Request-Trace", "trace-budget")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Trace", "trace-budget"))
                .andExpect(jsonPath("$.disposable").value(7000.0))
                .andExpect(jsonPath("$.savingsRatePercent").value(35.0))
                .andExpect(jsonPath("$.overallStatus").value("healthy"))
                .andExpect(jsonPath("$.categories", hasSize(3)))
                .andExpect(jsonPath("$.categories[0].status").value("ok"))
                .andExpect(jsonPath("$.narrative").doesNotExist())
                .andExpect(jsonPath("$.traceId").value("trace-budget"));
    }

    @Test
    void narrativeFallsBackWhenProviderIsUnreachable() throws Exception {
        String body = """
                {"income": 10000, "fixedExpenses": 7000, "variableExpenses": 4000}
                """;
        mockMvc.perform(post("/planning/budget?narrative=true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallStatus").value("critical"))
                .andExpect(jsonPath("$.narrative").value(NarrativeService.FALLBACK_NARRATIVE))
                .andExpect(jsonPath("$.narrativeGenerated").value(false));
    }

    @Test
    void plansDebtsWithSpanishStrategyLabel() throws Exception {
        String body = """
                {
                  "debts": [
                    {"name": "Car loan", "principal": 20000, "annual_rate": 12, "minimum_payment": 500},
                    {"name": "Credit card", "principal": 5000, "annual_rate": 36, "minimum_payment": 300}
                  ],
                  "monthly_income_available": 1000,
                  "strategy": "avalancha"
                }
                """;
        mockMvc.perform(post("/planning/debts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("avalanche"))
                .andExpect(jsonPath("$.debts[0].name").value("Credit card"))
                .andExpect(jsonPath("$.debts[0].priority").value(1))
                .andExpect(jsonPath("$.payoffOrder[0]").value("1. Credit card (36.00%, $5,000.00)"))
                .andExpect(jsonPath("$.allPaidOff").value(true));
    }

    @Test
    void unpayableDebtIsUnprocessable() throws Exception {
        String body = """
                {
                  "debts": [{"name": "Credit card", "principal": 10000, "annualRate": 24, "minimumPayment": 100}],
                  "monthlyIncomeAvailable": 1000,
                  "strategy": "avalanche"
                }
                """;
        mockMvc.perform(post("/planning/debts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DEBT_UNPAYABLE"))
                .andExpect(jsonPath("$.details.debt").value("Credit card"))
                .andExpect(jsonPath("$.traceId").isNotEmpty());
    }

    @Test
    void minimumsAboveIncomeAreUnprocessable() throws Exception {
        String body = """
                {
                  "debts": [{"name": "Card", "principal": 5000, "annualRate": 30, "minimumPayment": 600}],
                  "monthlyIncomeAvailable": 400,
                  "strategy": "snowball"
                }
                """;
        mockMvc.perform(post("/planning/debts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_INCOME"))
                .andExpect(jsonPath("$.details.required").value(600.0))
                .andExpect(jsonPath("$.details.available").value(400.0));
    }

    @Test
    void unknownStrategyIsBadRequest() throws Exception {
        String body = """
                {
                  "debts": [{"name": "Card", "principal": 5000, "annualRate": 30, "minimumPayment": 600}],
                  "monthlyIncomeAvailable": 1000,
                  "strategy": "lottery"
                }
                """;
        mockMvc.perform(post("/planning/debts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    void negativeIncomeIsInvalidInput() throws Exception {
        String body = """
                {"income": -5, "fixedExpenses": 0, "variableExpenses": 0}
                """;
        mockMvc.perform(post("/planning/budget")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.details.violations[0]").value("income must be greater than 0"));
    }

    @Test
    void missingFieldIsValidationError() throws Exception {
        String body = """
                {"fixedExpenses": 100, "variableExpenses": 100}
                """;
        mockMvc.perform(post("/planning/budget")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void recommendsPortfolio() throws Exception {
        String body = """
                {"total_amount": 100000, "term_months": 24, "risk_profile": "moderado"}
                """;
        mockMvc.perform(post("/planning/investments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskProfile").value("moderate"))
                .andExpect(jsonPath("$.instruments", hasSize(4)))
                .andExpect(jsonPath("$.instruments[0].amount").value(30000.0))
                .andExpect(jsonPath("$.blendedAnnualReturn").value(11.15))
                .andExpect(jsonPath("$.overallRisk").value("medium"));
    }

    @Test
    void projectsWithYearlyRows() throws Exception {
        String body = """
                {"principal": 10000, "annualRate": 12, "months": 24}
                """;
        mockMvc.perform(post("/planning/projections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.yearly", hasSize(3)))
                .andExpect(jsonPath("$.yearly[1].balance").value(11268.25));
    }

    @Test
    void partialYearProjectionHasNoRows() throws Exception {
        String body = """
                {"principal": 10000, "annualRate": 12, "months": 12, "monthlyContribution": 0}
                """;
        mockMvc.perform(post("/planning/projections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.finalValue").value(11268.25))
                .andExpect(jsonPath("$.gain").value(1268.25));

        mockMvc.perform(post("/planning/projections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"principal\": 1000, \"annualRate\": 5, \"months\": 7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.yearly", hasSize(0)));
    }

    @Test
    void oversizedProjectionHorizonIsInvalidInput() throws Exception {
        mockMvc.perform(post("/planning/projections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"principal\": 1000, \"annualRate\": 12, \"months\": 2147483647}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.details.violations[0]").value("months must be between 1 and 600"));
    }
}
