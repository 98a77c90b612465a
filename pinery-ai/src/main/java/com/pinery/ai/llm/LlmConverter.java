package com.pinery.ai.llm;

import com.pinery.ai.AiException;
import com.pinery.ai.LlmClient;
import com.pinery.converter.codegen.CodeGenerator;
import com.pinery.converter.codegen.GeneratedCode;
import com.pinery.core.script.PineAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Conversion through the LLM collaborator with a bounded number of attempts.
 *
 * A candidate is accepted only when it passes the syntax and entry-point checks applied to
 * rule-based output. After a rejected candidate the next attempt sends a refinement prompt with
 * the validation errors; after a transport failure the same prompt is sent again.
 */
public class LlmConverter {

    private static final Logger log = LoggerFactory.getLogger(LlmConverter.class);

    public static final int DEFAULT_MAX_RETRIES = 3;

    private final LlmClient client;
    private final PromptBuilder prompts;
    private final LlmResponseParser parser;
    private final CostEstimator costs;
    private final int maxRetries;
    private final Duration retryDelay;

    public LlmConverter(LlmClient client, CostEstimator costs) {
        this(client, costs, DEFAULT_MAX_RETRIES, Duration.ofSeconds(1));
    }

    /**
     * @param retryDelay base delay before re-sending after a transport failure, doubled per attempt
     */
    public LlmConverter(LlmClient client, CostEstimator costs, int maxRetries, Duration retryDelay) {
        this(client, new PromptBuilder(), new LlmResponseParser(), costs, maxRetries, retryDelay);
    }

    public LlmConverter(LlmClient client, PromptBuilder prompts, LlmResponseParser parser, CostEstimator costs,
                        int maxRetries, Duration retryDelay) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
        }
        this.client = client;
        this.prompts = prompts;
        this.parser = parser;
        this.costs = costs;
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
    }

    /**
     * Accepted candidate with the number of calls it took and their estimated cost.
     */
    public record LlmResult(GeneratedCode code, int attempts, CostEstimate cost, Duration elapsed) {
    }

    /**
     * Outcome of a verification request.
     */
    public record VerificationResult(LlmResponseParser.Verification verdict, CostEstimate cost) {
    }

    public int maxRetries() {
        return maxRetries;
    }

    public LlmResult convert(PineAst ast) throws AiException {
        return convert(ast, null, maxRetries);
    }

    /**
     * @param priorAttempt rule-based draft to patch, or null for a conversion from scratch
     * @param attempts     calls allowed for this conversion
     * @throws AiException the last transport error, or INVALID_RESPONSE when no candidate passed validation
     */
    public LlmResult convert(PineAst ast, String priorAttempt, int attempts) throws AiException {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1: " + attempts);
        }
        long start = System.nanoTime();
        String fallbackClass = CodeGenerator.className(ast.scriptName());
        log.info("LLM conversion of '{}' (complexity {}, up to {} attempts)",
            ast.scriptName(), String.format("%.3f", ast.complexityScore()), attempts);

        String prompt = prompts.buildConversionPrompt(ast, priorAttempt);
        CostEstimate cost = CostEstimate.zero();
        AiException lastError = null;
        LlmResponseParser.ParsedResponse lastCandidate = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            String response;
            try {
                response = client.submit(prompt);
            } catch (AiException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastError = e;
                log.warn("LLM call failed (attempt {}/{}): {}", attempt, attempts, e.getMessage());
                if (attempt < attempts) {
                    pause(attempt);
                }
                continue;
            }
            cost = cost.plus(costs.actual(prompt, response));

            LlmResponseParser.ParsedResponse candidate = parser.parse(response, fallbackClass);
            if (candidate.success()) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                log.info("LLM conversion of '{}' accepted after {} attempt(s), ~{} tokens, ${}",
                    ast.scriptName(), attempt, cost.totalTokens(), String.format("%.4f", cost.costUsd()));
                GeneratedCode code = candidate.toGeneratedCode(
                    List.of("Converted by the LLM collaborator in " + attempt + " attempt(s); review before live use"));
                return new LlmResult(code, attempt, cost, elapsed);
            }

            lastCandidate = candidate;
            log.warn("LLM candidate rejected (attempt {}/{}): {}", attempt, attempts, String.join("; ", candidate.errors()));
            prompt = prompts.buildRefinementPrompt(ast, candidate.code(), candidate.errors());
        }

        if (lastCandidate != null) {
            throw new AiException(AiException.ErrorType.INVALID_RESPONSE,
                "No valid candidate after " + attempts + " attempt(s): " + String.join("; ", lastCandidate.errors()),
                lastError);
        }
        throw new AiException(lastError.getType(),
            "LLM unavailable after " + attempts + " attempt(s): " + lastError.getMessage(), lastError);
    }

    /**
     * Ask whether {@code pythonCode} implements the script.
     */
    public VerificationResult verify(PineAst ast, String pythonCode) throws AiException {
        String prompt = prompts.buildVerificationPrompt(ast.source(), pythonCode);
        String response = client.submit(prompt);
        return new VerificationResult(parser.parseVerification(response), costs.actual(prompt, response));
    }

    /**
     * Cost of a conversion prompt for this script, before anything is sent.
     */
    public CostEstimate estimateCost(PineAst ast) {
        return costs.estimate(prompts.buildConversionPrompt(ast, null));
    }

    private void pause(int attempt) throws AiException {
        long millis = retryDelay.toMillis() << (attempt - 1);
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiException(AiException.ErrorType.UNKNOWN, "Interrupted while waiting to retry", e);
        }
    }
}
