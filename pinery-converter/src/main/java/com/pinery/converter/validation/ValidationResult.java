package com.pinery.converter.validation;

import java.util.List;
import java.util.Locale;

/**
 * Verdict of the complexity validator.
 *
 * @param errors              one entry per violated rule; any entry makes the script ineligible
 * @param warnings            non-blocking notes
 * @param unsupportedFeatures the subset of problems caused by language features rather than size
 * @param rankedFactors       factor contributions to the score, largest first
 */
public record ValidationResult(
    boolean valid,
    double complexityScore,
    Recommendation recommendation,
    List<String> errors,
    List<String> warnings,
    List<String> unsupportedFeatures,
    List<FactorContribution> rankedFactors
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        unsupportedFeatures = List.copyOf(unsupportedFeatures);
        rankedFactors = List.copyOf(rankedFactors);
    }

    public boolean hasUnsupportedFeatures() {
        return !unsupportedFeatures.isEmpty();
    }

    /**
     * Recommendation with score and the first issues, for logs and reports.
     */
    public String describe() {
        String text = String.format(Locale.ROOT, "%s (complexity: %.2f)", recommendation.label(), complexityScore);
        if (!valid && !errors.isEmpty()) {
            text += ". Issues: " + String.join(", ", errors.subList(0, Math.min(2, errors.size())));
        }
        return text;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ValidationResult(%s, score=%.3f, %d errors)",
            valid ? "VALID" : "INVALID", complexityScore, errors.size());
    }

    /**
     * Weighted share of one complexity factor.
     */
    public record FactorContribution(String factor, double value, double weight) {

        public double contribution() {
            return value * weight;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "%s=%.3f (x%.2f)", factor, value, weight);
        }
    }
}
