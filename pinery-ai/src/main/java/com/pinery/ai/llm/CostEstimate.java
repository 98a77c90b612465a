package com.pinery.ai.llm;

/**
 * Token and dollar estimate for one LLM call.
 */
public record CostEstimate(long inputTokens, long outputTokens, double costUsd) {

    public static CostEstimate zero() {
        return new CostEstimate(0, 0, 0.0);
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public CostEstimate plus(CostEstimate other) {
        return new CostEstimate(inputTokens + other.inputTokens, outputTokens + other.outputTokens,
            costUsd + other.costUsd);
    }
}
