package com.pinery.core.config;

import com.pinery.core.script.ComplexityFactor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for YAML configuration loading.
 */
class PineryConfigTest {

    @Test
    @DisplayName("Defaults match the documented bands")
    void defaults() {
        PineryConfig config = PineryConfig.defaults();
        assertEquals(0.3, config.getValidation().getRuleBasedMaxScore());
        assertEquals(0.7, config.getValidation().getHybridMaxScore());
        assertEquals(1, config.getValidation().getMaxNestingDepth());
        assertEquals(0.75, config.getGeneration().getEntryConfidence());
        assertEquals(0.25, config.getComplexity().weight(ComplexityFactor.LINES));
        assertEquals(150, config.getComplexity().saturation(ComplexityFactor.LINES));
    }

    @Test
    @DisplayName("Bundled defaults resource loads")
    void classpathDefaults() {
        PineryConfig config = PineryConfig.fromClasspath("pinery-defaults.yaml");
        assertEquals(0.20, config.getComplexity().weight(ComplexityFactor.FUNCTIONS));
        assertEquals("indicator_runtime", config.getGeneration().getRuntimeModule());
    }

    @Test
    @DisplayName("Missing keys keep built-in values")
    void partialFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pinery.yaml");
        Files.writeString(file, "validation:\n  ruleBasedMaxScore: 0.25\nunknownKey: 1\n");

        PineryConfig config = PineryConfig.load(file);
        assertEquals(0.25, config.getValidation().getRuleBasedMaxScore());
        assertEquals(0.7, config.getValidation().getHybridMaxScore());
        assertEquals(0.75, config.getGeneration().getEntryConfidence());
    }

    @Test
    @DisplayName("Negative weight in file is rejected")
    void negativeWeight(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bad.yaml");
        Files.writeString(file, "complexity:\n  weights:\n    FUNCTIONS: -1\n");
        assertThrows(IllegalArgumentException.class, () -> PineryConfig.load(file));
    }

    @Test
    @DisplayName("Missing file is an IOException")
    void missingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> PineryConfig.load(dir.resolve("nope.yaml")));
    }

    @Test
    @DisplayName("Unknown classpath resource is rejected")
    void missingResource() {
        assertThrows(IllegalArgumentException.class, () -> PineryConfig.fromClasspath("missing.yaml"));
    }
}
