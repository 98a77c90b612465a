package com.pinery.ai;

/**
 * Failure talking to the LLM collaborator, or an answer that cannot be used.
 */
public class AiException extends Exception {

    public enum ErrorType {
        NOT_FOUND,        // CLI not found at configured path, or no collaborator configured
        NOT_LOGGED_IN,    // Authentication required
        API_KEY_MISSING,  // API key not configured or rejected
        RATE_LIMITED,     // Provider throttled the request
        TIMEOUT,          // Request timed out
        INVALID_RESPONSE, // Answer carried no usable code
        UNKNOWN           // Other errors
    }

    private final ErrorType type;

    public AiException(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public AiException(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ErrorType getType() {
        return type;
    }

    /**
     * Check if this error suggests the user needs to authenticate.
     */
    public boolean requiresAuthentication() {
        return type == ErrorType.NOT_LOGGED_IN || type == ErrorType.API_KEY_MISSING;
    }

    /**
     * Whether asking again can help. Configuration and authentication problems cannot.
     */
    public boolean isRetryable() {
        return type == ErrorType.TIMEOUT || type == ErrorType.RATE_LIMITED
            || type == ErrorType.INVALID_RESPONSE || type == ErrorType.UNKNOWN;
    }
}
