package com.pinery.ai.strategy;

/**
 * Chosen conversion path with the selector's confidence and expected cost and duration.
 */
public record StrategyDecision(
    ConversionStrategy strategy,
    double confidence,
    String reason,
    double estimatedCostUsd,
    double estimatedSeconds
) {

    public static StrategyDecision of(ConversionStrategy strategy, double confidence, String reason) {
        return new StrategyDecision(strategy, confidence, reason, strategy.estimatedCostUsd(), strategy.estimatedSeconds());
    }

    /**
     * Decision forced by the caller instead of derived from the script.
     */
    public static StrategyDecision forced(ConversionStrategy strategy) {
        return of(strategy, 1.0, "Strategy forced to " + strategy.id());
    }
}
