package com.pinery.converter.validation;

import com.pinery.core.config.PineryConfig;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.ScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rule-based eligibility.
 */
class ComplexityValidatorTest {

    static final String SMA_CROSS = """
        //@version=5
        strategy("SMA Cross")
        length = input(20)
        ma = ta.sma(close, length)
        if ta.crossover(close, ma)
            strategy.entry("Long", strategy.long)
        """;

    private ScriptParser parser;
    private ComplexityValidator validator;

    @BeforeEach
    void setUp() {
        parser = new ScriptParser();
        validator = new ComplexityValidator();
    }

    @Test
    @DisplayName("Simple crossover strategy is rule-based eligible")
    void simpleStrategy() {
        ValidationResult result = validator.validate(parser.parse(SMA_CROSS));

        assertTrue(result.valid(), result.describe());
        assertTrue(result.complexityScore() < 0.3);
        assertEquals(Recommendation.RULE_BASED, result.recommendation());
        assertTrue(result.errors().isEmpty());
        assertFalse(result.hasUnsupportedFeatures());
        assertEquals(0.3, validator.maxComplexity());
    }

    @Test
    @DisplayName("Custom function blocks rule-based conversion")
    void customFunction() {
        PineAst ast = parser.parse("""
            strategy("Fn")
            twice(x) => x * 2
            v = twice(close)
            if v > open
                strategy.entry("L", strategy.long)
            """);
        ValidationResult result = validator.validate(ast);

        assertFalse(result.valid());
        assertTrue(result.errors().stream().anyMatch(e -> e.contains("custom function")), result.describe());
        assertTrue(result.unsupportedFeatures().contains("custom functions"));
        assertNotEquals(Recommendation.RULE_BASED, result.recommendation());
    }

    @Test
    @DisplayName("Input count alone never gates eligibility")
    void manyInputs() {
        StringBuilder script = new StringBuilder("strategy(\"Inputs\")\n");
        for (int i = 0; i < 25; i++) {
            script.append("p").append(i).append(" = input.int(").append(i + 1).append(", \"P").append(i).append("\")\n");
        }
        script.append("if close > open\n    strategy.entry(\"L\", strategy.long)\n");
        PineAst ast = parser.parse(script.toString());

        assertEquals(25, ast.inputs().size());
        ValidationResult result = validator.validate(ast);
        assertTrue(result.valid(), result.describe());
        assertEquals(Recommendation.RULE_BASED, result.recommendation());
    }

    @Test
    @DisplayName("Nesting deeper than one level is rejected")
    void nesting() {
        PineAst ast = parser.parse("""
            strategy("Nested")
            if close > open
                if volume > 0
                    strategy.entry("L", strategy.long)
            """);
        ValidationResult result = validator.validate(ast);

        assertFalse(result.valid());
        assertTrue(result.errors().stream().anyMatch(e -> e.contains("nesting depth 2")), result.describe());
        assertFalse(result.hasUnsupportedFeatures());
        assertEquals(Recommendation.HYBRID, result.recommendation());
    }

    @Test
    @DisplayName("Loops are listed as unsupported constructs")
    void loops() {
        PineAst ast = parser.parse("""
            strategy("Loop")
            total = 0.0
            for i = 0 to 10
                total := total + close[i]
            """);
        ValidationResult result = validator.validate(ast);

        assertFalse(result.valid());
        assertTrue(result.unsupportedFeatures().contains("for loop"));
        assertTrue(result.errors().stream().anyMatch(e -> e.startsWith("Unsupported construct: for loop")));
    }

    @Test
    @DisplayName("Indicator scripts and drawings produce warnings only")
    void warnings() {
        PineAst ast = parser.parse("""
            indicator("Draw")
            label.new(bar_index, high, "x")
            """);
        ValidationResult result = validator.validate(ast);

        assertTrue(result.valid(), result.describe());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("drawing object")));
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("not strategy")));
    }

    @Test
    @DisplayName("A lowered threshold turns a simple script into a hybrid candidate")
    void configuredThreshold() {
        PineryConfig config = PineryConfig.defaults();
        config.getValidation().setRuleBasedMaxScore(0.0);
        ValidationResult result = new ComplexityValidator(config).validate(parser.parse(SMA_CROSS));

        assertFalse(result.valid());
        assertEquals(Recommendation.HYBRID, result.recommendation());
        assertTrue(result.errors().get(0).startsWith("Complexity score"));
    }

    @Test
    @DisplayName("Factor contributions are ranked largest first")
    void rankedFactors() {
        ValidationResult result = validator.validate(parser.parse(SMA_CROSS));
        double previous = Double.MAX_VALUE;
        for (ValidationResult.FactorContribution factor : result.rankedFactors()) {
            assertTrue(factor.contribution() <= previous);
            previous = factor.contribution();
        }
        assertEquals(8, result.rankedFactors().size());
    }
}
