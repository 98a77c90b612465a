package com.pinery.ai.llm;

import com.pinery.ai.AiException;
import com.pinery.ai.ScriptedLlmClient;
import com.pinery.converter.ComplexityException;
import com.pinery.converter.ConversionException;
import com.pinery.converter.RuleBasedConverter;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.ScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;

import static com.pinery.ai.ScriptedLlmClient.VALID_ANSWER;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rule-based conversion backed by the LLM.
 */
class HybridConverterTest {

    private static final String ELIGIBLE = """
        strategy("SMA Cross")
        ma = ta.sma(close, 20)
        if ta.crossover(close, ma)
            strategy.entry("Long", strategy.long)
        """;

    private static final String NESTED = """
        strategy("Nested")
        if close > open
            if volume > 0
                strategy.entry("L", strategy.long)
        """;

    private ScriptParser parser;
    private RuleBasedConverter ruleBased;

    @BeforeEach
    void setUp() {
        parser = new ScriptParser();
        ruleBased = new RuleBasedConverter();
    }

    private HybridConverter hybrid(ScriptedLlmClient client, boolean verify, boolean acceptDraft) {
        LlmConverter llm = new LlmConverter(client, new CostEstimator(3.0, 15.0), 3, Duration.ZERO);
        return new HybridConverter(ruleBased, llm, verify, 2, acceptDraft);
    }

    @Test
    @DisplayName("Eligible script never reaches the LLM")
    void ruleBasedWins() throws ConversionException {
        ScriptedLlmClient client = new ScriptedLlmClient();

        HybridConverter.HybridResult result = hybrid(client, false, false).convert(parser.parse(ELIGIBLE));

        assertTrue(result.ruleBasedSucceeded());
        assertFalse(result.llmUsed());
        assertEquals("SMACross", result.code().className());
        assertTrue(client.prompts().isEmpty());
    }

    @Test
    @DisplayName("Verification issues become warnings on the rule-based result")
    void verificationIssues() throws ConversionException {
        ScriptedLlmClient client = new ScriptedLlmClient("INCORRECT: crossover direction reversed");

        HybridConverter.HybridResult result = hybrid(client, true, false).convert(parser.parse(ELIGIBLE));

        assertTrue(result.ruleBasedSucceeded());
        assertTrue(result.llmUsed());
        assertEquals("SMACross", result.code().className());
        assertTrue(result.code().warnings().contains("LLM verification: crossover direction reversed"));
    }

    @Test
    @DisplayName("Unavailable verification keeps the rule-based result")
    void verificationUnavailable() throws ConversionException {
        ScriptedLlmClient client = new ScriptedLlmClient(ScriptedLlmClient.timeout());

        HybridConverter.HybridResult result = hybrid(client, true, false).convert(parser.parse(ELIGIBLE));

        assertTrue(result.code().isSuccess());
        assertTrue(result.code().warnings().stream().anyMatch(w -> w.startsWith("LLM verification unavailable")));
    }

    @Test
    @DisplayName("Ineligible script is patched by the LLM from the rule-based draft")
    void patched() throws ConversionException {
        ScriptedLlmClient client = new ScriptedLlmClient(VALID_ANSWER);

        HybridConverter.HybridResult result = hybrid(client, false, false).convert(parser.parse(NESTED));

        assertFalse(result.ruleBasedSucceeded());
        assertTrue(result.llmUsed());
        assertEquals("Converted", result.code().className());
        assertTrue(result.code().warnings().stream().anyMatch(w -> w.startsWith("Rule-based conversion failed")));
        assertTrue(client.prompts().get(0).contains("# Prior Rule-Based Attempt"));
        assertTrue(client.prompts().get(0).contains("class Nested:"));
    }

    @Test
    @DisplayName("Both paths failing raises ConversionException with both causes")
    void bothFail() {
        ScriptedLlmClient client = new ScriptedLlmClient(ScriptedLlmClient.noKey());
        PineAst ast = parser.parse(NESTED);

        ConversionException e = assertThrows(ConversionException.class, () -> hybrid(client, false, false).convert(ast));
        assertTrue(e.getMessage().startsWith("Rule-based and LLM conversion both failed for 'Nested'"));
        assertInstanceOf(AiException.class, e.getCause());
        assertTrue(Arrays.stream(e.getSuppressed()).anyMatch(s -> s instanceof ComplexityException));
    }

    @Test
    @DisplayName("Unverified draft is accepted only when configured")
    void unverifiedDraft() throws ConversionException {
        ScriptedLlmClient client = new ScriptedLlmClient(ScriptedLlmClient.noKey());

        HybridConverter.HybridResult result = hybrid(client, false, true).convert(parser.parse(NESTED));

        assertEquals("Nested", result.code().className());
        assertTrue(result.code().warnings().stream().anyMatch(w -> w.startsWith("UNVERIFIED")));
        assertTrue(result.code().warnings().stream().anyMatch(w -> w.startsWith("LLM patching failed")));
    }
}
