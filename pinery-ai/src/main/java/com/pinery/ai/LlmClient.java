package com.pinery.ai;

/**
 * Text-completion collaborator used by the assisted conversion paths.
 */
@FunctionalInterface
public interface LlmClient {

    /**
     * Send a prompt and return the raw answer text.
     *
     * @throws AiException if the collaborator is unreachable, times out or refuses the request
     */
    String submit(String prompt) throws AiException;
}
