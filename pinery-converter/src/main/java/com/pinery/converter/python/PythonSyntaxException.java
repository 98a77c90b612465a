package com.pinery.converter.python;

/**
 * Syntax error found while checking Python text. Internal to the validator,
 * callers receive a {@link SyntaxCheckResult}.
 */
class PythonSyntaxException extends RuntimeException {

    private final int line;

    PythonSyntaxException(String message, int line) {
        super(message);
        this.line = line;
    }

    int getLine() {
        return line;
    }
}
