package com.pinery.core.dsl;

/**
 * Thrown when an expression cannot be parsed.
 */
public class ParseException extends RuntimeException {

    private final int position;

    public ParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Character offset of the offending token in the parsed text.
     */
    public int getPosition() {
        return position;
    }
}
