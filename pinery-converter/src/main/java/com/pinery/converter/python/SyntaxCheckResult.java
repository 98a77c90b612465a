package com.pinery.converter.python;

/**
 * Outcome of a Python syntax or contract check.
 *
 * @param line one-based line of the first problem, 0 when valid or not tied to a line
 */
public record SyntaxCheckResult(boolean valid, String message, int line) {

    public static SyntaxCheckResult ok() {
        return new SyntaxCheckResult(true, "", 0);
    }

    public static SyntaxCheckResult error(String message, int line) {
        return new SyntaxCheckResult(false, message, line);
    }

    /**
     * "message (line N)" for logs and warnings.
     */
    public String describe() {
        if (valid) {
            return "valid";
        }
        return line > 0 ? message + " (line " + line + ")" : message;
    }
}
