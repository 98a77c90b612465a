package com.pinery.ai.strategy;

import com.pinery.ai.AiConfig;
import com.pinery.ai.AiException;
import com.pinery.ai.ScriptedLlmClient;
import com.pinery.ai.llm.CostEstimator;
import com.pinery.converter.RuleBasedConverter;
import com.pinery.core.config.PineryConfig;
import com.pinery.core.script.ScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.pinery.ai.ScriptedLlmClient.VALID_ANSWER;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for tier selection, fallback and caching.
 */
class StrategySelectorTest {

    static final String ELIGIBLE = """
        strategy("SMA Cross")
        ma = ta.sma(close, 20)
        if ta.crossover(close, ma)
            strategy.entry("Long", strategy.long)
        """;

    static final String LOOP = """
        strategy("Loop Sum")
        total = 0.0
        for i = 0 to 10
            total := total + close[i]
        """;

    private AiConfig.SelectorSettings settings;
    private PineryConfig config;

    @BeforeEach
    void setUp() {
        settings = new AiConfig.SelectorSettings();
        config = PineryConfig.defaults();
    }

    private StrategySelector selector(ScriptedLlmClient client, ConversionCache cache) {
        return new StrategySelector(settings, new RuleBasedConverter(config), new ScriptParser(config),
            client, cache, new CostEstimator(3.0, 15.0), Duration.ZERO);
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Eligible low-complexity script goes rule-based")
        void ruleBased() {
            StrategyDecision decision = selector(null, null).recommend(ELIGIBLE);

            assertEquals(ConversionStrategy.RULE_BASED, decision.strategy());
            assertEquals(0.95, decision.confidence());
            assertEquals(0.0, decision.estimatedCostUsd());
            assertEquals(1.0, decision.estimatedSeconds());
            assertTrue(decision.reason().startsWith("Low complexity ("));
        }

        @Test
        @DisplayName("Low complexity with unsupported constructs goes hybrid")
        void lowButIneligible() {
            StrategyDecision decision = selector(null, null).recommend(LOOP);

            assertEquals(ConversionStrategy.HYBRID, decision.strategy());
            assertEquals(0.80, decision.confidence());
            assertTrue(decision.reason().contains("for loop"));
            assertEquals(0.005, decision.estimatedCostUsd());
        }

        @Test
        @DisplayName("Cost optimization lowers an LLM band below 0.8 to hybrid")
        void costOptimization() {
            config.getValidation().setHybridMaxScore(0.0);

            StrategyDecision decision = selector(null, null).recommend(LOOP);

            assertEquals(ConversionStrategy.HYBRID, decision.strategy());
            assertEquals(0.70, decision.confidence());
            assertTrue(decision.reason().endsWith("(cost optimization)"));
        }

        @Test
        @DisplayName("Without cost optimization the LLM band stays LLM-only")
        void llmOnly() {
            config.getValidation().setHybridMaxScore(0.0);
            settings.setCostOptimization(false);

            StrategyDecision decision = selector(null, null).recommend(LOOP);

            assertEquals(ConversionStrategy.LLM_ONLY, decision.strategy());
            assertEquals(0.90, decision.confidence());
            assertEquals(30.0, decision.estimatedSeconds());
        }

        @Test
        @DisplayName("Fallback chains start with the chosen tier")
        void chains() {
            assertEquals(List.of(ConversionStrategy.RULE_BASED, ConversionStrategy.HYBRID, ConversionStrategy.LLM_ONLY),
                StrategySelector.fallbackChain(ConversionStrategy.RULE_BASED));
            assertEquals(List.of(ConversionStrategy.HYBRID, ConversionStrategy.LLM_ONLY),
                StrategySelector.fallbackChain(ConversionStrategy.HYBRID));
            assertEquals(List.of(ConversionStrategy.LLM_ONLY, ConversionStrategy.HYBRID, ConversionStrategy.RULE_BASED),
                StrategySelector.fallbackChain(ConversionStrategy.LLM_ONLY));
        }
    }

    @Nested
    @DisplayName("Conversion")
    class Conversion {

        @Test
        @DisplayName("Rule-based tier costs nothing and never calls the LLM")
        void ruleBased() throws ConversionFailedException {
            ScriptedLlmClient client = new ScriptedLlmClient();

            ConversionOutcome outcome = selector(client, null).convert(ELIGIBLE);

            assertEquals(ConversionStrategy.RULE_BASED, outcome.strategyUsed());
            assertEquals("SMACross", outcome.code().className());
            assertEquals(0.0, outcome.costUsd());
            assertFalse(outcome.fromCache());
            assertFalse(outcome.fellBack());
            assertTrue(client.prompts().isEmpty());
        }

        @Test
        @DisplayName("Hybrid tier patches an ineligible script")
        void hybrid() throws ConversionFailedException {
            ScriptedLlmClient client = new ScriptedLlmClient(VALID_ANSWER);

            ConversionOutcome outcome = selector(client, null).convert(LOOP);

            assertEquals(ConversionStrategy.HYBRID, outcome.strategyUsed());
            assertEquals("Converted", outcome.code().className());
            assertTrue(outcome.costUsd() > 0);
            assertTrue(outcome.warnings().stream().anyMatch(w -> w.startsWith("Rule-based conversion failed")));
        }

        @Test
        @DisplayName("Failed tier falls back to the next one in its chain")
        void fallback() throws ConversionFailedException {
            config.getValidation().setHybridMaxScore(0.0);
            settings.setCostOptimization(false);
            ScriptedLlmClient client = new ScriptedLlmClient(ScriptedLlmClient.noKey(), VALID_ANSWER);

            ConversionOutcome outcome = selector(client, null).convert(LOOP);

            assertEquals(ConversionStrategy.LLM_ONLY, outcome.decision().strategy());
            assertEquals(ConversionStrategy.HYBRID, outcome.strategyUsed());
            assertTrue(outcome.fellBack());
            assertTrue(outcome.warnings().contains("llm_only failed: no key"));
        }

        @Test
        @DisplayName("Every tier failing raises one exception with each failure suppressed")
        void allFail() {
            StrategySelector selector = selector(null, null);
            assertFalse(selector.hasLlm());

            ConversionFailedException e = assertThrows(ConversionFailedException.class, () -> selector.convert(LOOP));
            assertEquals(List.of(ConversionStrategy.HYBRID, ConversionStrategy.LLM_ONLY), e.getAttempted());
            assertEquals(2, e.getSuppressed().length);
            for (Throwable suppressed : e.getSuppressed()) {
                AiException ai = assertInstanceOf(AiException.class, suppressed);
                assertEquals(AiException.ErrorType.NOT_FOUND, ai.getType());
            }
        }

        @Test
        @DisplayName("Forced tier runs alone")
        void forced() throws ConversionFailedException {
            ScriptedLlmClient client = new ScriptedLlmClient(VALID_ANSWER);

            ConversionOutcome outcome = selector(client, null).convert(ELIGIBLE, ConversionStrategy.LLM_ONLY);

            assertEquals(ConversionStrategy.LLM_ONLY, outcome.strategyUsed());
            assertEquals(1.0, outcome.decision().confidence());
            assertEquals(1, client.prompts().size());

            ConversionFailedException e = assertThrows(ConversionFailedException.class,
                () -> selector(null, null).convert(ELIGIBLE, ConversionStrategy.HYBRID));
            assertEquals(List.of(ConversionStrategy.HYBRID), e.getAttempted());
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        private ConversionCache cache;

        @BeforeEach
        void setUp() {
            cache = new ConversionCache(30, null, Clock.systemUTC());
        }

        @Test
        @DisplayName("Second conversion of the same source is served from cache")
        void hit() throws ConversionFailedException {
            StrategySelector selector = selector(null, cache);

            ConversionOutcome first = selector.convert(ELIGIBLE);
            ConversionOutcome second = selector.convert(ELIGIBLE.replace("\n", "  \r\n"));

            assertFalse(first.fromCache());
            assertTrue(second.fromCache());
            assertEquals(ConversionStrategy.RULE_BASED, second.strategyUsed());
            assertEquals(first.code().fullCode(), second.code().fullCode());
            assertEquals("SMACross", second.code().className());
            assertEquals(first.code().indicatorsUsed(), second.code().indicatorsUsed());
            assertEquals(0.0, second.costUsd());
            assertTrue(second.warnings().get(0).startsWith("Served from cache"));
        }

        @Test
        @DisplayName("LLM results are cached with their cost")
        void llmCached() throws ConversionFailedException {
            ScriptedLlmClient client = new ScriptedLlmClient(VALID_ANSWER);
            StrategySelector selector = selector(client, cache);

            ConversionOutcome first = selector.convert(LOOP);
            ConversionOutcome second = selector.convert(LOOP);

            assertEquals(1, client.prompts().size());
            assertTrue(second.fromCache());
            assertEquals(ConversionStrategy.HYBRID, second.strategyUsed());
            assertEquals(first.costUsd(), cache.get(LOOP).orElseThrow().costUsd());
        }

        @Test
        @DisplayName("Failures are not cached")
        void failureNotCached() {
            StrategySelector selector = selector(null, cache);

            assertThrows(ConversionFailedException.class, () -> selector.convert(LOOP));
            assertEquals(0, cache.size());
        }
    }
}
