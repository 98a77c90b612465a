package com.pinery.ai.llm;

import com.pinery.core.script.PineAst;
import com.pinery.core.script.ScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LLM prompt construction.
 */
class PromptBuilderTest {

    private static final String SCRIPT = """
        //@version=5
        strategy("SMA Cross")
        length = input.int(20, "Length")
        ma = ta.sma(close, length)
        twice(x) => x * 2
        if ta.crossover(close, ma)
            strategy.entry("Long", strategy.long)
        """;

    private PromptBuilder prompts;
    private PineAst ast;

    @BeforeEach
    void setUp() {
        prompts = new PromptBuilder();
        ast = new ScriptParser().parse(SCRIPT);
    }

    @Test
    @DisplayName("Conversion prompt carries source, metadata, inputs, indicators and contract")
    void conversionPrompt() {
        String prompt = prompts.buildConversionPrompt(ast, null);

        assertTrue(prompt.startsWith(PromptBuilder.SYSTEM_INSTRUCTIONS));
        assertTrue(prompt.contains("Convert the following Pine Script strategy to Python."));
        assertTrue(prompt.contains("```pinescript\n//@version=5"));
        assertTrue(prompt.contains("- Name: SMA Cross"));
        assertTrue(prompt.contains("- Pine Version: v5"));
        assertTrue(prompt.contains("- length: int = 20 (title: 'Length')"));
        assertTrue(prompt.contains("- ta.sma"));
        assertTrue(prompt.contains("# Custom Functions"));
        assertTrue(prompt.contains("- twice(x: Any)"));
        assertTrue(prompt.contains("class SMACross:"));
        assertTrue(prompt.contains("def generate_signal(current_price, candles, params=None, current_position=None):"));
        assertFalse(prompt.contains("# Prior Rule-Based Attempt"));
    }

    @Test
    @DisplayName("Prior attempt is included when given")
    void priorAttempt() {
        String prompt = prompts.buildConversionPrompt(ast, "class SMACross:\n    pass\n");

        assertTrue(prompt.contains("# Prior Rule-Based Attempt"));
        assertTrue(prompt.contains("```python\nclass SMACross:\n    pass\n```"));
    }

    @Test
    @DisplayName("Verification prompt shows both sides and the expected verdicts")
    void verificationPrompt() {
        String prompt = prompts.buildVerificationPrompt("plot(close)\n", "x = 1\n");

        assertTrue(prompt.contains("```pinescript\nplot(close)\n```"));
        assertTrue(prompt.contains("```python\nx = 1\n```"));
        assertTrue(prompt.contains("\"" + PromptBuilder.VERDICT_CORRECT + "\""));
        assertTrue(prompt.contains(PromptBuilder.VERDICT_INCORRECT));
    }

    @Test
    @DisplayName("Refinement prompt numbers the errors and repeats code and source")
    void refinementPrompt() {
        String prompt = prompts.buildRefinementPrompt(ast, "def f(:\n", List.of("first", "second"));

        assertTrue(prompt.contains("# Task: Fix Validation Errors"));
        assertTrue(prompt.contains("1. first\n2. second"));
        assertTrue(prompt.contains("```python\ndef f(:\n```"));
        assertTrue(prompt.contains("strategy(\"SMA Cross\")"));
        assertTrue(prompt.contains("# Output Contract"));
    }
}
