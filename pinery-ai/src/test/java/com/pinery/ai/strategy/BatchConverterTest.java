package com.pinery.ai.strategy;

import com.pinery.ai.AiConfig;
import com.pinery.ai.llm.CostEstimator;
import com.pinery.converter.RuleBasedConverter;
import com.pinery.core.script.ScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parallel batch conversion.
 */
class BatchConverterTest {

    private StrategySelector selector;

    @BeforeEach
    void setUp() {
        selector = new StrategySelector(new AiConfig.SelectorSettings(), new RuleBasedConverter(), new ScriptParser(),
            null, null, new CostEstimator(0.0, 0.0), Duration.ZERO);
    }

    @Test
    @DisplayName("Results keep input order and one failure does not affect the others")
    void mixed() throws InterruptedException {
        List<String> sources = List.of(
            StrategySelectorTest.ELIGIBLE,
            StrategySelectorTest.LOOP,
            StrategySelectorTest.ELIGIBLE.replace("SMA Cross", "Second Cross"));

        List<BatchConverter.BatchResult> results = new BatchConverter(selector, 2).convertAll(sources);

        assertEquals(3, results.size());
        for (int i = 0; i < results.size(); i++) {
            assertEquals(i, results.get(i).index());
        }
        assertTrue(results.get(0).isSuccess());
        assertEquals("SMACross", results.get(0).outcome().code().className());
        assertFalse(results.get(1).isSuccess());
        assertInstanceOf(ConversionFailedException.class, results.get(1).error());
        assertEquals("SecondCross", results.get(2).outcome().code().className());
    }

    @Test
    @DisplayName("Many scripts on a small pool all convert")
    void many() throws InterruptedException {
        List<String> sources = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            sources.add(StrategySelectorTest.ELIGIBLE.replace("SMA Cross", "Cross " + i));
        }

        List<BatchConverter.BatchResult> results = new BatchConverter(selector).convertAll(sources);

        assertEquals(12, results.size());
        assertTrue(results.stream().allMatch(BatchConverter.BatchResult::isSuccess));
        assertEquals("Cross7", results.get(7).outcome().code().className());
    }

    @Test
    @DisplayName("Parallel conversion of distinct scripts matches sequential conversion")
    void matchesSequential() throws Exception {
        List<String> sources = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            sources.add(StrategySelectorTest.ELIGIBLE
                .replace("SMA Cross", "Cross " + i)
                .replace("ta.sma(close, 20)", "ta.sma(close, " + (10 + i) + ")")
                .replace("ta.crossover(close, ma)", "ta.crossover(close, ma) and close > open"));
        }
        List<String> expected = new ArrayList<>();
        for (String source : sources) {
            expected.add(selector.convert(source).code().fullCode());
        }

        List<BatchConverter.BatchResult> results = new BatchConverter(selector, 4).convertAll(sources);

        for (int i = 0; i < sources.size(); i++) {
            BatchConverter.BatchResult result = results.get(i);
            assertTrue(result.isSuccess(), () -> String.valueOf(result.error()));
            assertEquals(expected.get(i), result.outcome().code().fullCode());
            assertTrue(result.outcome().code().fullCode().contains("ta.sma\", self.close, " + (10 + i) + ")"));
        }
    }

    @Test
    @DisplayName("Empty input yields no results")
    void empty() throws InterruptedException {
        assertTrue(new BatchConverter(selector).convertAll(List.of()).isEmpty());
    }
}
