package com.pinery.ai;

/**
 * Supported LLM collaborator types. CLI providers run a local command, GEMINI is called over HTTP.
 */
public enum AiProvider {
    CLAUDE,
    CODEX,
    CUSTOM,
    GEMINI;

    public boolean isCli() {
        return this != GEMINI;
    }
}
