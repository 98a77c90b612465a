package com.pinery.ai.llm;

import com.pinery.ai.AiProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for token and cost estimates.
 */
class CostEstimatorTest {

    private final CostEstimator estimator = new CostEstimator(3.0, 15.0);

    @Test
    @DisplayName("Four characters per token")
    void tokens() {
        assertEquals(2, CostEstimator.tokens("abcdefgh"));
        assertEquals(0, CostEstimator.tokens("abc"));
        assertEquals(0, CostEstimator.tokens(null));
    }

    @Test
    @DisplayName("Estimate assumes output 2.5 times the prompt")
    void estimate() {
        CostEstimate cost = estimator.estimate("x".repeat(400));

        assertEquals(100, cost.inputTokens());
        assertEquals(250, cost.outputTokens());
        assertEquals(100 * 3.0 / 1_000_000 + 250 * 15.0 / 1_000_000, cost.costUsd(), 1e-12);
    }

    @Test
    @DisplayName("Actual cost uses the response length")
    void actual() {
        CostEstimate cost = estimator.actual("x".repeat(400), "y".repeat(40));

        assertEquals(100, cost.inputTokens());
        assertEquals(10, cost.outputTokens());
        assertEquals(110, cost.totalTokens());
    }

    @Test
    @DisplayName("Costs add up")
    void plus() {
        CostEstimate sum = new CostEstimate(10, 20, 0.5).plus(new CostEstimate(1, 2, 0.25));

        assertEquals(11, sum.inputTokens());
        assertEquals(22, sum.outputTokens());
        assertEquals(0.75, sum.costUsd(), 1e-12);
        assertEquals(0.0, CostEstimate.zero().costUsd());
    }

    @Test
    @DisplayName("Profile prices feed the estimator")
    void forProfile() {
        AiProfile profile = new AiProfile();
        profile.setInputCostPerMillion(1_000_000.0);
        profile.setOutputCostPerMillion(0.0);

        CostEstimate cost = CostEstimator.forProfile(profile).actual("x".repeat(8), "");
        assertEquals(2.0, cost.costUsd(), 1e-9);
    }
}
