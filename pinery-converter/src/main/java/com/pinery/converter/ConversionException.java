package com.pinery.converter;

import java.util.List;

/**
 * Generation, formatting or syntax validation failed for an eligible script.
 */
public class ConversionException extends ConverterException {

    private final List<String> errors;
    private final String draft;

    public ConversionException(String message, List<String> errors, String draft) {
        super(message);
        this.errors = List.copyOf(errors);
        this.draft = draft;
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(String.valueOf(cause.getMessage()));
        this.draft = null;
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Rejected code, or null when generation did not get that far.
     */
    public String getDraft() {
        return draft;
    }
}
