package com.pinery.converter.validation;

import com.pinery.core.config.PineryConfig;
import com.pinery.core.script.ComplexityFactor;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Decides whether a parsed script is eligible for rule-based conversion.
 *
 * Eligible when the score is below the rule-based threshold and the script has no custom
 * functions, custom types, array/matrix operations or unsupported constructs, and its
 * conditional nesting stays within the limit. Otherwise the score picks hybrid or LLM.
 * The number of inputs is deliberately not a criterion. Never mutates the AST.
 */
public class ComplexityValidator {

    private static final Logger log = LoggerFactory.getLogger(ComplexityValidator.class);

    private final PineryConfig.ValidationSettings settings;
    private final PineryConfig.ComplexitySettings complexity;

    public ComplexityValidator() {
        this(PineryConfig.defaults());
    }

    public ComplexityValidator(PineryConfig config) {
        this.settings = config.getValidation();
        this.complexity = config.getComplexity();
    }

    public double maxComplexity() {
        return settings.getRuleBasedMaxScore();
    }

    public ValidationResult validate(PineAst ast) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();

        log.info("Validating '{}' (complexity: {})", ast.scriptName(), format(ast.complexityScore()));

        // Score
        if (ast.complexityScore() >= settings.getRuleBasedMaxScore()) {
            errors.add(String.format(Locale.ROOT,
                "Complexity score %.3f exceeds threshold %.3f. Use LLM-based conversion instead.",
                ast.complexityScore(), settings.getRuleBasedMaxScore()));
        }

        // Custom functions
        if (ast.hasFunctions()) {
            String names = ast.functions().stream().map(Statement.FunctionNode::name).collect(Collectors.joining(", "));
            errors.add("Found " + ast.functions().size() + " custom function(s) (" + names + "). " +
                "Custom functions require LLM-based conversion.");
            unsupported.add("custom functions");
        }

        // Arrays and matrices
        if (ast.hasArrayMatrixOps()) {
            errors.add("Advanced array/matrix operations detected (" + ast.arrayMatrixReferences() + " references). " +
                "These require LLM-based conversion.");
            unsupported.add("array/matrix operations");
        }

        // Custom types
        if (ast.hasCustomTypes()) {
            errors.add("Custom type definitions detected (" + ast.customTypes().size() + "). " +
                "These require LLM-based conversion.");
            unsupported.add("custom types");
        }

        // Nesting
        if (ast.maxNestingDepth() > settings.getMaxNestingDepth()) {
            errors.add("Conditional nesting depth " + ast.maxNestingDepth() + " exceeds maximum " +
                settings.getMaxNestingDepth() + ". Use LLM-based conversion.");
        }

        // Loops, switch, imports, if-expressions
        for (Statement.UnsupportedNode node : ast.unsupported()) {
            errors.add("Unsupported construct: " + node.construct() + " (line " + node.line() + ")");
            if (!unsupported.contains(node.construct())) {
                unsupported.add(node.construct());
            }
        }

        // Warnings
        if (ast.indicatorsUsed().size() > settings.getIndicatorWarningCount()) {
            warnings.add("Strategy uses " + ast.indicatorsUsed().size() + " indicators. " +
                "Verify all are supported by the indicator runtime.");
        }
        if (ast.drawingObjects() > 0) {
            warnings.add(ast.drawingObjects() + " drawing object(s) detected. These will be converted to comments.");
        }
        if (!ast.isStrategy()) {
            warnings.add("Script is declared as " + ast.scriptType().name().toLowerCase(Locale.ROOT) +
                ", not strategy; signals come only from strategy.* calls.");
        }

        boolean valid = errors.isEmpty();
        Recommendation recommendation = recommend(valid, ast.complexityScore());
        ValidationResult result = new ValidationResult(valid, ast.complexityScore(), recommendation,
            errors, warnings, unsupported, rankFactors(ast));

        if (valid) {
            log.info("Validation passed for '{}'", ast.scriptName());
        } else {
            log.warn("Validation failed for '{}': {} errors", ast.scriptName(), errors.size());
        }
        return result;
    }

    /**
     * Recommended conversion path for the script.
     */
    public Recommendation recommendation(PineAst ast) {
        return validate(ast).recommendation();
    }

    private Recommendation recommend(boolean valid, double score) {
        if (valid) {
            return Recommendation.RULE_BASED;
        }
        if (score < settings.getHybridMaxScore()) {
            return Recommendation.HYBRID;
        }
        return Recommendation.LLM;
    }

    private List<ValidationResult.FactorContribution> rankFactors(PineAst ast) {
        List<ValidationResult.FactorContribution> factors = new ArrayList<>();
        for (ComplexityFactor factor : ComplexityFactor.values()) {
            double value = ast.complexityFactors().getOrDefault(factor.key(), 0.0);
            factors.add(new ValidationResult.FactorContribution(factor.key(), value, complexity.weight(factor)));
        }
        factors.sort(Comparator.comparingDouble(ValidationResult.FactorContribution::contribution).reversed()
            .thenComparing(ValidationResult.FactorContribution::factor));
        return factors;
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.3f", score);
    }
}
