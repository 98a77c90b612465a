package com.pinery.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the YAML-backed LLM configuration.
 */
class AiConfigTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Profiles and selector settings survive a save and load")
    void roundTrip() throws IOException {
        AiConfig config = new AiConfig();
        config.addProfile(new AiProfile("claude", "Claude", AiProvider.CLAUDE));
        AiProfile gemini = new AiProfile("gemini", "Gemini", AiProvider.GEMINI);
        gemini.setApiKey("secret");
        gemini.setTimeoutSeconds(30);
        config.addProfile(gemini);
        config.setDefaultProfileId("gemini");
        config.getSelector().setBatchThreads(8);
        config.getSelector().setCostOptimization(false);

        Path file = dir.resolve("nested").resolve("ai.yaml");
        config.save(file);
        AiConfig loaded = AiConfig.load(file);

        assertEquals(2, loaded.getProfiles().size());
        AiProfile profile = loaded.getDefaultProfile();
        assertEquals("gemini", profile.getId());
        assertEquals(AiProvider.GEMINI, profile.getProvider());
        assertEquals("secret", profile.getApiKey());
        assertEquals(30, profile.getTimeoutSeconds());
        assertEquals(8, loaded.getSelector().getBatchThreads());
        assertFalse(loaded.getSelector().isCostOptimization());
        assertEquals(3, loaded.getSelector().getLlmMaxRetries());
    }

    @Test
    @DisplayName("Missing file fails on load and yields defaults on loadOrDefault")
    void missingFile() throws IOException {
        Path file = dir.resolve("absent.yaml");

        assertThrows(IOException.class, () -> AiConfig.load(file));
        AiConfig config = AiConfig.loadOrDefault(file);
        assertTrue(config.getProfiles().isEmpty());
        assertNull(config.getDefaultProfile());
        assertEquals(30, config.getSelector().getCacheTtlDays());
    }

    @Test
    @DisplayName("Unknown keys are ignored")
    void unknownKeys() throws IOException {
        Path file = dir.resolve("ai.yaml");
        Files.writeString(file, """
            theme: dark
            profiles:
              - id: local
                name: Local
                provider: CUSTOM
                command: ollama run llama3
                colour: green
            selector:
              hybridMaxRetries: 5
            """);

        AiConfig config = AiConfig.load(file);
        assertEquals("local", config.getDefaultProfile().getId());
        assertEquals("ollama run llama3", config.getDefaultProfile().getCommand());
        assertEquals(5, config.getSelector().getHybridMaxRetries());
    }

    @Test
    @DisplayName("Removing the default profile moves the default to the first remaining one")
    void removeDefault() {
        AiConfig config = new AiConfig();
        config.addProfile(new AiProfile("a", "A", AiProvider.CLAUDE));
        config.addProfile(new AiProfile("b", "B", AiProvider.CODEX));
        config.setDefaultProfileId("b");

        config.removeProfile("b");
        assertEquals("a", config.getDefaultProfileId());
        assertNull(config.getProfile("b"));
    }
}
