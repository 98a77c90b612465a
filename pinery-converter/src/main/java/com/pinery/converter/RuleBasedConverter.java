package com.pinery.converter;

import com.pinery.converter.codegen.CodeGenerator;
import com.pinery.converter.codegen.GeneratedCode;
import com.pinery.converter.validation.ComplexityValidator;
import com.pinery.converter.validation.Recommendation;
import com.pinery.converter.validation.ValidationResult;
import com.pinery.core.config.PineryConfig;
import com.pinery.core.indicators.registry.IndicatorRegistry;
import com.pinery.core.indicators.registry.IndicatorRegistryInitializer;
import com.pinery.core.script.PineAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based Pine Script to Python conversion: validate, then generate.
 *
 * {@link #canConvert(PineAst)} and {@link #convert(PineAst)} agree for every AST: a result that is
 * not valid is exactly the case in which convert throws {@link ComplexityException} or
 * {@link UnsupportedFeatureException}. A failed generation never comes back as code, it surfaces as
 * {@link ConversionException}.
 */
public class RuleBasedConverter {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedConverter.class);

    private final ComplexityValidator validator;
    private final CodeGenerator generator;

    public RuleBasedConverter() {
        this(PineryConfig.defaults());
    }

    public RuleBasedConverter(PineryConfig config) {
        this(config, IndicatorRegistryInitializer.standard());
    }

    public RuleBasedConverter(PineryConfig config, IndicatorRegistry registry) {
        this(new ComplexityValidator(config), new CodeGenerator(config, registry));
    }

    public RuleBasedConverter(ComplexityValidator validator, CodeGenerator generator) {
        this.validator = validator;
        this.generator = generator;
    }

    /**
     * Whether the script is eligible, with the reasons when it is not. Generates nothing.
     */
    public ValidationResult canConvert(PineAst ast) {
        return validator.validate(ast);
    }

    public Recommendation recommendation(PineAst ast) {
        return validator.recommendation(ast);
    }

    /**
     * Python source of the converted strategy.
     */
    public String convert(PineAst ast) throws ConverterException {
        return generate(ast).fullCode();
    }

    /**
     * Validate and generate.
     *
     * @throws UnsupportedFeatureException if the script uses features the rule-based path never translates
     * @throws ComplexityException         if the script is otherwise ineligible
     * @throws ConversionException         if generation fails for an eligible script
     */
    public GeneratedCode generate(PineAst ast) throws ConverterException {
        ValidationResult validation = validator.validate(ast);
        if (!validation.valid()) {
            if (validation.hasUnsupportedFeatures()) {
                throw new UnsupportedFeatureException(
                    "Unsupported features for rule-based conversion: " + String.join(", ", validation.unsupportedFeatures()),
                    validation.unsupportedFeatures(), validation.errors());
            }
            throw new ComplexityException(
                "Script not eligible for rule-based conversion: " + String.join("; ", validation.errors()),
                validation.complexityScore(), validation.errors(), validation.rankedFactors());
        }

        GeneratedCode code = draft(ast);
        if (!code.isSuccess()) {
            throw new ConversionException("Code generation failed for '" + ast.scriptName() + "': "
                + String.join("; ", code.errors()), code.errors(), code.fullCode());
        }
        log.info("Converted '{}' to {}", ast.scriptName(), code.className());
        return code.withWarnings(validation.warnings());
    }

    /**
     * Best-effort generation without the eligibility check. The result may be a failure
     * carrying its rejected draft; used as the starting point for assisted conversion.
     *
     * @throws ConversionException if generation itself breaks
     */
    public GeneratedCode draft(PineAst ast) throws ConversionException {
        try {
            return generator.generate(ast);
        } catch (RuntimeException e) {
            log.error("Generator failed for '{}'", ast.scriptName(), e);
            throw new ConversionException("Code generation failed for '" + ast.scriptName() + "': " + e.getMessage(), e);
        }
    }

    public ComplexityValidator validator() {
        return validator;
    }

    public CodeGenerator generator() {
        return generator;
    }
}
