package com.pinery.converter;

import com.pinery.converter.validation.ValidationResult;

import java.util.List;

/**
 * Script is too complex for rule-based conversion. Carries the score and the reasons, and the
 * factor contributions ranked from largest to smallest.
 */
public class ComplexityException extends ConverterException {

    private final double score;
    private final List<String> reasons;
    private final List<ValidationResult.FactorContribution> rankedFactors;

    public ComplexityException(String message, double score, List<String> reasons,
                               List<ValidationResult.FactorContribution> rankedFactors) {
        super(message);
        this.score = score;
        this.reasons = List.copyOf(reasons);
        this.rankedFactors = List.copyOf(rankedFactors);
    }

    public double getScore() {
        return score;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public List<ValidationResult.FactorContribution> getRankedFactors() {
        return rankedFactors;
    }
}
