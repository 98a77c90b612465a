package com.pinery.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link LlmClient} backed by one {@link AiProfile}: a local CLI (Claude, Codex or a custom command)
 * run with the profile timeout, or the Gemini HTTP API.
 */
public class AiClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(AiClient.class);

    public static final String GEMINI_API_BASE = "https://generativelanguage.googleapis.com/v1beta/models/";
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final MediaType JSON_MEDIA = MediaType.get("application/json");
    private static final int VERSION_TIMEOUT_SECONDS = 5;

    private final AiProfile profile;
    private final String geminiApiBase;
    private final OkHttpClient httpClient;

    private Consumer<String> logCallback;

    public AiClient(AiProfile profile) {
        this(profile, GEMINI_API_BASE);
    }

    /**
     * @param geminiApiBase base URL ending in "/" that model names are appended to
     */
    public AiClient(AiProfile profile, String geminiApiBase) {
        this.profile = profile;
        this.geminiApiBase = geminiApiBase;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(profile.getTimeoutSeconds()))
            .writeTimeout(Duration.ofSeconds(profile.getTimeoutSeconds()))
            .build();
    }

    public AiProfile getProfile() {
        return profile;
    }

    /**
     * Set a callback for activity logging.
     */
    public void setLogCallback(Consumer<String> callback) {
        this.logCallback = callback;
    }

    public String getProviderName() {
        return profile.getProvider().name();
    }

    /**
     * Check if the profile's CLI runs or its API key is accepted.
     */
    public boolean isAvailable() {
        try {
            getVersion();
            if (profile.getProvider() == AiProvider.GEMINI) {
                Request request = new Request.Builder()
                    .url(geminiApiBase.substring(0, geminiApiBase.length() - 1))
                    .header("x-goog-api-key", requireApiKey())
                    .get()
                    .build();
                try (Response response = httpClient.newCall(request).execute()) {
                    return response.isSuccessful();
                }
            }
            return true;
        } catch (AiException | IOException e) {
            log.debug("{} not available: {}", getProviderName(), e.getMessage());
            return false;
        }
    }

    /**
     * Get the version string from the profile's CLI, or the model for HTTP providers.
     */
    public String getVersion() throws AiException {
        if (profile.getProvider() == AiProvider.GEMINI) {
            return "Gemini API - " + profile.getModel();
        }
        String cliPath = getCliPath();
        if (cliPath.isBlank()) {
            throw new AiException(AiException.ErrorType.NOT_FOUND, "No CLI command configured");
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(cliPath, "--version");
            pb.redirectErrorStream(true);
            Process p = pb.start();
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(p.getInputStream()));

            boolean finished = p.waitFor(VERSION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                p.destroyForcibly();
                throw new AiException(AiException.ErrorType.TIMEOUT, "CLI not responding");
            }
            if (p.exitValue() != 0) {
                throw new AiException(AiException.ErrorType.NOT_FOUND, "CLI not found or error");
            }
            return output.get(VERSION_TIMEOUT_SECONDS, TimeUnit.SECONDS).trim();
        } catch (AiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiException(AiException.ErrorType.UNKNOWN, "Interrupted while checking CLI", e);
        } catch (Exception e) {
            throw new AiException(AiException.ErrorType.NOT_FOUND, "CLI not found: " + e.getMessage(), e);
        }
    }

    @Override
    public String submit(String prompt) throws AiException {
        String provider = getProviderName();
        log.debug("LLM query to {} ({}): {}", provider, profile.getName(), truncate(prompt, 100));

        if (profile.getProvider() == AiProvider.GEMINI) {
            return queryGemini(prompt);
        }
        return queryCli(prompt);
    }

    /**
     * Test the profile's connection.
     */
    public TestResult testConnection() {
        String version;
        try {
            version = getVersion();
        } catch (AiException e) {
            return new TestResult(false, null, e.getMessage());
        }
        try {
            String response = submit("Say OK");
            return new TestResult(true, version, "Response: " + truncate(response.trim(), 50));
        } catch (AiException e) {
            return new TestResult(false, version, e.getMessage());
        }
    }

    /**
     * Result of a connection test.
     */
    public record TestResult(boolean success, String version, String message) {
    }

    // ==================== CLI ====================

    private String queryCli(String prompt) throws AiException {
        String provider = getProviderName();
        String cliPath = getCliPath();
        if (cliPath.isBlank()) {
            throw new AiException(AiException.ErrorType.NOT_FOUND, provider + " CLI command not configured");
        }
        int timeoutSeconds = profile.getTimeoutSeconds();

        try {
            ProcessBuilder pb = buildProcess(cliPath, prompt);
            pb.redirectErrorStream(true);
            Process process = pb.start();

            // Claude reads the prompt from stdin, the others take it as an argument
            if (usesStdin()) {
                try (OutputStream stdin = process.getOutputStream()) {
                    stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
                    stdin.flush();
                }
            }
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                logActivity("[" + provider + "] Timeout after " + timeoutSeconds + "s");
                throw new AiException(AiException.ErrorType.TIMEOUT,
                    provider + " CLI timed out after " + timeoutSeconds + " seconds");
            }

            String result = output.get(timeoutSeconds, TimeUnit.SECONDS);
            if (process.exitValue() != 0) {
                AiException error = parseError(result, provider, cliPath);
                logActivity("[" + provider + "] Error: " + error.getMessage());
                throw error;
            }

            logActivity("[" + provider + "] Query completed (" + result.length() + " chars)");
            log.debug("LLM response from {}: {}", provider, truncate(result, 200));
            return result;
        } catch (AiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiException(AiException.ErrorType.UNKNOWN, "Interrupted while waiting for " + provider, e);
        } catch (Exception e) {
            logActivity("[" + provider + "] Error: " + e.getMessage());
            throw new AiException(AiException.ErrorType.UNKNOWN, "Query failed: " + e.getMessage(), e);
        }
    }

    private String getCliPath() {
        return switch (profile.getProvider()) {
            case CUSTOM -> {
                String cmd = profile.getCommand();
                if (cmd == null || cmd.isBlank()) yield "";
                yield cmd.trim().split("\\s+", 2)[0];
            }
            case GEMINI -> profile.getModel();
            default -> profile.getPath() != null ? profile.getPath() : "";
        };
    }

    private ProcessBuilder buildProcess(String cliPath, String prompt) {
        List<String> args = new ArrayList<>();
        switch (profile.getProvider()) {
            case CODEX -> {
                args.add(cliPath);
                addArgs(args, profile.getArgs());
                args.add(prompt);
            }
            case CUSTOM -> {
                args.addAll(Arrays.asList(profile.getCommand().trim().split("\\s+")));
                args.add(prompt);
            }
            default -> {
                args.add(cliPath);
                addArgs(args, profile.getArgs());
            }
        }
        return new ProcessBuilder(args);
    }

    private static void addArgs(List<String> args, String extra) {
        if (extra != null && !extra.isBlank()) {
            args.addAll(Arrays.asList(extra.trim().split("\\s+")));
        }
    }

    private boolean usesStdin() {
        return profile.getProvider() == AiProvider.CLAUDE;
    }

    private static AiException parseError(String output, String provider, String cliPath) {
        String lower = output.toLowerCase(Locale.ROOT);

        if (lower.contains("log in") || lower.contains("login") || lower.contains("authenticate")) {
            return new AiException(AiException.ErrorType.NOT_LOGGED_IN,
                "Not logged in - run '" + cliPath + "' in terminal to authenticate");
        }
        if (lower.contains("api key") || lower.contains("apikey")) {
            return new AiException(AiException.ErrorType.API_KEY_MISSING, "API key missing or invalid");
        }
        if (lower.contains("rate limit") || lower.contains("too many requests")) {
            return new AiException(AiException.ErrorType.RATE_LIMITED, provider + " rate limit exceeded");
        }
        return new AiException(AiException.ErrorType.UNKNOWN, provider + " CLI failed: " + truncate(output, 100));
    }

    // ==================== Gemini ====================

    private String queryGemini(String prompt) throws AiException {
        String provider = getProviderName();
        String apiKey = requireApiKey();

        try {
            String body = JSON.writeValueAsString(Map.of(
                "contents", List.of(Map.of(
                    "parts", List.of(Map.of("text", prompt))
                )),
                "generationConfig", Map.of(
                    "temperature", 0.0,
                    "maxOutputTokens", 8192
                )
            ));

            Request request = new Request.Builder()
                .url(geminiApiBase + profile.getModel() + ":generateContent")
                .header("x-goog-api-key", apiKey)
                .header("Content-Type", "application/json")
                .post(RequestBody.create(body, JSON_MEDIA))
                .build();

            try (Response response = httpClient.newCall(request).execute()) {
                String responseBody = response.body() != null ? response.body().string() : "";

                if (!response.isSuccessful()) {
                    AiException error = switch (response.code()) {
                        case 401, 403 -> new AiException(AiException.ErrorType.API_KEY_MISSING,
                            "Gemini API key invalid or unauthorized (HTTP " + response.code() + ")");
                        case 429 -> new AiException(AiException.ErrorType.RATE_LIMITED,
                            "Gemini rate limit exceeded (HTTP 429)");
                        default -> new AiException(AiException.ErrorType.UNKNOWN,
                            "Gemini API error (HTTP " + response.code() + "): " + truncate(responseBody, 200));
                    };
                    logActivity("[" + provider + "] Error: " + error.getMessage());
                    throw error;
                }

                JsonNode candidates = JSON.readTree(responseBody).path("candidates");
                if (candidates.isMissingNode() || candidates.isEmpty()) {
                    throw new AiException(AiException.ErrorType.INVALID_RESPONSE,
                        "Gemini returned no candidates: " + truncate(responseBody, 200));
                }

                StringBuilder result = new StringBuilder();
                for (JsonNode part : candidates.get(0).path("content").path("parts")) {
                    result.append(part.path("text").asText(""));
                }
                if (result.length() == 0) {
                    throw new AiException(AiException.ErrorType.INVALID_RESPONSE, "Gemini returned an empty answer");
                }

                logActivity("[" + provider + "] Query completed (" + result.length() + " chars)");
                log.debug("LLM response from {}: {}", provider, truncate(result.toString(), 200));
                return result.toString();
            }
        } catch (AiException e) {
            throw e;
        } catch (SocketTimeoutException e) {
            logActivity("[" + provider + "] Timeout");
            throw new AiException(AiException.ErrorType.TIMEOUT,
                "Gemini API timed out after " + profile.getTimeoutSeconds() + " seconds", e);
        } catch (IOException e) {
            logActivity("[" + provider + "] Error: " + e.getMessage());
            throw new AiException(AiException.ErrorType.UNKNOWN, "Gemini query failed: " + e.getMessage(), e);
        }
    }

    private String requireApiKey() throws AiException {
        String apiKey = profile.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new AiException(AiException.ErrorType.API_KEY_MISSING, "Gemini API key not configured");
        }
        return apiKey;
    }

    // ==================== Helpers ====================

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void logActivity(String summary) {
        if (logCallback != null) {
            logCallback.accept(summary);
        }
    }

    static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
