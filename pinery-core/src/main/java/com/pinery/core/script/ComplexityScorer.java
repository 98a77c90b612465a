package com.pinery.core.script;

import com.pinery.core.config.PineryConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted complexity score in [0, 1].
 *
 * Every factor is min(1, raw / saturation) and the weights are non-negative, so the score never
 * decreases when any raw count grows.
 */
public class ComplexityScorer {

    private final PineryConfig.ComplexitySettings settings;

    public ComplexityScorer(PineryConfig.ComplexitySettings settings) {
        settings.validate();
        this.settings = settings;
    }

    /**
     * Raw counts per factor.
     */
    public record Counts(int codeLines, int functions, int customTypes, int arrayMatrixReferences,
                         int drawingObjects, int maxNestingDepth, int distinctIndicators, int variables) {

        int raw(ComplexityFactor factor) {
            return switch (factor) {
                case LINES -> codeLines;
                case FUNCTIONS -> functions;
                case CUSTOM_TYPES -> customTypes;
                case ARRAY_MATRIX -> arrayMatrixReferences;
                case DRAWING -> drawingObjects;
                case NESTING -> maxNestingDepth;
                case INDICATORS -> distinctIndicators;
                case VARIABLES -> variables;
            };
        }
    }

    public record Score(double value, Map<String, Double> factors) {}

    public Score score(Counts counts) {
        Map<String, Double> factors = new LinkedHashMap<>();
        double total = 0;
        for (ComplexityFactor factor : ComplexityFactor.values()) {
            double normalized = Math.min(1.0, Math.max(0, counts.raw(factor)) / settings.saturation(factor));
            factors.put(factor.key(), round(normalized));
            total += settings.weight(factor) * normalized;
        }
        return new Score(round(Math.min(1.0, Math.max(0.0, total))), factors);
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
