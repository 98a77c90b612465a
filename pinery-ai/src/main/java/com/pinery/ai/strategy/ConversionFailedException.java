package com.pinery.ai.strategy;

import java.util.List;

/**
 * No conversion path produced valid code. Each path's failure is attached as a suppressed exception.
 */
public class ConversionFailedException extends Exception {

    private final List<ConversionStrategy> attempted;

    public ConversionFailedException(String message, List<ConversionStrategy> attempted) {
        super(message);
        this.attempted = List.copyOf(attempted);
    }

    public ConversionFailedException(String message, Throwable cause) {
        super(message, cause);
        this.attempted = List.of();
    }

    /**
     * Paths tried, in order.
     */
    public List<ConversionStrategy> getAttempted() {
        return attempted;
    }
}
