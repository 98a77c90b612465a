package com.pinery.ai.strategy;

import com.pinery.converter.validation.Recommendation;

/**
 * Conversion path, cheapest first.
 */
public enum ConversionStrategy {
    RULE_BASED("rule_based", 0.0, 1.0),
    HYBRID("hybrid", 0.005, 15.0),
    LLM_ONLY("llm_only", 0.02, 30.0);

    private final String id;
    private final double estimatedCostUsd;
    private final double estimatedSeconds;

    ConversionStrategy(String id, double estimatedCostUsd, double estimatedSeconds) {
        this.id = id;
        this.estimatedCostUsd = estimatedCostUsd;
        this.estimatedSeconds = estimatedSeconds;
    }

    public String id() {
        return id;
    }

    public double estimatedCostUsd() {
        return estimatedCostUsd;
    }

    public double estimatedSeconds() {
        return estimatedSeconds;
    }

    public boolean usesLlm() {
        return this != RULE_BASED;
    }

    public static ConversionStrategy of(Recommendation recommendation) {
        return switch (recommendation) {
            case RULE_BASED -> RULE_BASED;
            case HYBRID -> HYBRID;
            case LLM -> LLM_ONLY;
        };
    }

    public static ConversionStrategy fromId(String id) {
        for (ConversionStrategy strategy : values()) {
            if (strategy.id.equals(id) || strategy.name().equalsIgnoreCase(id)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown conversion strategy: " + id);
    }
}
