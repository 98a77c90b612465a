package com.pinery.ai.strategy;

import com.pinery.converter.codegen.GeneratedCode;

import java.time.Duration;
import java.util.List;

/**
 * Result of a routed conversion.
 *
 * @param strategyUsed tier that produced the code, which differs from the decision after a fallback
 * @param warnings     code warnings followed by fallback notes
 */
public record ConversionOutcome(
    GeneratedCode code,
    ConversionStrategy strategyUsed,
    StrategyDecision decision,
    double costUsd,
    Duration elapsed,
    boolean fromCache,
    List<String> warnings
) {

    public ConversionOutcome {
        warnings = List.copyOf(warnings);
    }

    public boolean fellBack() {
        return !fromCache && strategyUsed != decision.strategy();
    }
}
