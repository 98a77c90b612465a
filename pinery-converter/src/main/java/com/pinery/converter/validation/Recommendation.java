package com.pinery.converter.validation;

/**
 * Conversion path a script falls into.
 */
public enum Recommendation {
    RULE_BASED("Rule-based conversion recommended"),
    HYBRID("Hybrid conversion recommended"),
    LLM("LLM-based conversion required");

    private final String label;

    Recommendation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
