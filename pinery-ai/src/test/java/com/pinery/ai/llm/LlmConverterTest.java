package com.pinery.ai.llm;

import com.pinery.ai.AiException;
import com.pinery.ai.ScriptedLlmClient;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.ScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.pinery.ai.ScriptedLlmClient.INVALID_ANSWER;
import static com.pinery.ai.ScriptedLlmClient.VALID_ANSWER;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for bounded LLM conversion.
 */
class LlmConverterTest {

    private static final String SCRIPT = """
        strategy("Loop Sum")
        total = 0.0
        for i = 0 to 10
            total := total + close[i]
        """;

    private static final CostEstimator COSTS = new CostEstimator(3.0, 15.0);

    private PineAst ast;

    @BeforeEach
    void setUp() {
        ast = new ScriptParser().parse(SCRIPT);
    }

    private static LlmConverter converter(ScriptedLlmClient client, int retries) {
        return new LlmConverter(client, COSTS, retries, Duration.ZERO);
    }

    @Test
    @DisplayName("Valid first answer is accepted")
    void firstAttempt() throws AiException {
        ScriptedLlmClient client = new ScriptedLlmClient(VALID_ANSWER);

        LlmConverter.LlmResult result = converter(client, 3).convert(ast);

        assertEquals(1, result.attempts());
        assertEquals("Converted", result.code().className());
        assertTrue(result.code().isSuccess());
        assertTrue(result.code().warnings().get(0).startsWith("Converted by the LLM collaborator in 1 attempt(s)"));
        assertTrue(result.cost().costUsd() > 0);
        assertTrue(client.prompts().get(0).contains("strategy(\"Loop Sum\")"));
    }

    @Test
    @DisplayName("Any submit function can act as the client")
    void lambdaClient() throws AiException {
        LlmConverter converter = new LlmConverter(prompt -> VALID_ANSWER, COSTS);

        assertEquals(LlmConverter.DEFAULT_MAX_RETRIES, converter.maxRetries());
        assertEquals(1, converter.convert(ast).attempts());
    }

    @Test
    @DisplayName("Rejected candidate triggers a refinement prompt")
    void refinement() throws AiException {
        ScriptedLlmClient client = new ScriptedLlmClient(INVALID_ANSWER, VALID_ANSWER);

        LlmConverter.LlmResult result = converter(client, 3).convert(ast);

        assertEquals(2, result.attempts());
        assertTrue(client.prompts().get(1).contains("# Task: Fix Validation Errors"));
        assertTrue(client.prompts().get(1).contains("def run(price):"));
    }

    @Test
    @DisplayName("Transport failure re-sends the same prompt")
    void retryAfterTimeout() throws AiException {
        ScriptedLlmClient client = new ScriptedLlmClient(ScriptedLlmClient.timeout(), VALID_ANSWER);

        LlmConverter.LlmResult result = converter(client, 3).convert(ast);

        assertEquals(2, result.attempts());
        assertEquals(client.prompts().get(0), client.prompts().get(1));
    }

    @Test
    @DisplayName("Configuration errors are not retried")
    void nonRetryable() {
        ScriptedLlmClient client = new ScriptedLlmClient(ScriptedLlmClient.noKey(), VALID_ANSWER);

        AiException e = assertThrows(AiException.class, () -> converter(client, 3).convert(ast));
        assertEquals(AiException.ErrorType.API_KEY_MISSING, e.getType());
        assertEquals(1, client.prompts().size());
    }

    @Test
    @DisplayName("Only rejected candidates ends in INVALID_RESPONSE")
    void exhaustedCandidates() {
        ScriptedLlmClient client = new ScriptedLlmClient(INVALID_ANSWER, INVALID_ANSWER, VALID_ANSWER);

        AiException e = assertThrows(AiException.class, () -> converter(client, 2).convert(ast));
        assertEquals(AiException.ErrorType.INVALID_RESPONSE, e.getType());
        assertTrue(e.getMessage().startsWith("No valid candidate after 2 attempt(s)"));
        assertEquals(2, client.prompts().size());
    }

    @Test
    @DisplayName("Only transport failures keep the last error type")
    void exhaustedTransport() {
        ScriptedLlmClient client = new ScriptedLlmClient(ScriptedLlmClient.timeout(), ScriptedLlmClient.timeout());

        AiException e = assertThrows(AiException.class, () -> converter(client, 2).convert(ast));
        assertEquals(AiException.ErrorType.TIMEOUT, e.getType());
        assertTrue(e.getMessage().startsWith("LLM unavailable after 2 attempt(s)"));
    }

    @Test
    @DisplayName("Prior rule-based attempt goes into the prompt")
    void priorAttempt() throws AiException {
        ScriptedLlmClient client = new ScriptedLlmClient(VALID_ANSWER);

        converter(client, 3).convert(ast, "total = 0.0", 1);
        assertTrue(client.prompts().get(0).contains("# Prior Rule-Based Attempt"));
    }

    @Test
    @DisplayName("At least one attempt is required")
    void invalidAttempts() {
        ScriptedLlmClient client = new ScriptedLlmClient();

        assertThrows(IllegalArgumentException.class, () -> converter(client, 0));
        assertThrows(IllegalArgumentException.class, () -> converter(client, 1).convert(ast, null, 0));
    }

    @Test
    @DisplayName("Verification parses the verdict and prices the call")
    void verify() throws AiException {
        ScriptedLlmClient client = new ScriptedLlmClient("INCORRECT: wrong period");

        LlmConverter.VerificationResult result = converter(client, 1).verify(ast, "x = 1\n");

        assertFalse(result.verdict().correct());
        assertEquals("wrong period", result.verdict().issues().get(0));
        assertTrue(result.cost().inputTokens() > 0);
    }

    @Test
    @DisplayName("Cost estimate is computed without calling the client")
    void estimateCost() {
        ScriptedLlmClient client = new ScriptedLlmClient();

        CostEstimate estimate = converter(client, 1).estimateCost(ast);
        assertTrue(estimate.outputTokens() > estimate.inputTokens());
        assertTrue(client.prompts().isEmpty());
    }
}
