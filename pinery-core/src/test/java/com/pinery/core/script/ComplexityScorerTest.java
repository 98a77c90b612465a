package com.pinery.core.script;

import com.pinery.core.config.PineryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the weighted complexity score.
 */
class ComplexityScorerTest {

    private final ComplexityScorer scorer = new ComplexityScorer(new PineryConfig.ComplexitySettings());

    private static ComplexityScorer.Counts counts(int lines, int functions) {
        return new ComplexityScorer.Counts(lines, functions, 0, 0, 0, 0, 0, 0);
    }

    @Test
    @DisplayName("Empty script scores zero")
    void zero() {
        ComplexityScorer.Score score = scorer.score(new ComplexityScorer.Counts(0, 0, 0, 0, 0, 0, 0, 0));
        assertEquals(0.0, score.value());
        assertEquals(ComplexityFactor.values().length, score.factors().size());
        assertEquals(0.0, score.factors().get("lines"));
    }

    @Test
    @DisplayName("Factors saturate at 1.0")
    void saturation() {
        ComplexityScorer.Score score = scorer.score(counts(300, 0));
        assertEquals(1.0, score.factors().get("lines"));
        assertEquals(0.25, score.value(), 1e-9);
    }

    @Test
    @DisplayName("Fully saturated script scores 1.0")
    void maximum() {
        ComplexityScorer.Score score = scorer.score(new ComplexityScorer.Counts(500, 10, 10, 50, 10, 10, 30, 100));
        assertEquals(1.0, score.value(), 1e-9);
    }

    @Test
    @DisplayName("Score never decreases when a count grows")
    void monotonic() {
        double previous = -1;
        for (int functions = 0; functions <= 5; functions++) {
            double value = scorer.score(counts(40, functions)).value();
            assertTrue(value >= previous, "score dropped at functions=" + functions);
            previous = value;
        }
    }

    @Test
    @DisplayName("Negative weights are rejected")
    void negativeWeight() {
        PineryConfig.ComplexitySettings settings = new PineryConfig.ComplexitySettings()
            .withWeight(ComplexityFactor.FUNCTIONS, -0.1);
        assertThrows(IllegalArgumentException.class, () -> new ComplexityScorer(settings));
    }

    @Test
    @DisplayName("Custom weights change the score")
    void customWeight() {
        PineryConfig.ComplexitySettings settings = new PineryConfig.ComplexitySettings()
            .withWeight(ComplexityFactor.FUNCTIONS, 0.5);
        ComplexityScorer custom = new ComplexityScorer(settings);
        assertEquals(0.5, custom.score(counts(0, 3)).value(), 1e-9);
    }
}
