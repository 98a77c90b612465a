package com.pinery.core.script;

/**
 * Factors that feed the complexity score.
 * Each factor is normalized to [0, 1] by dividing its raw count by a saturation point.
 */
public enum ComplexityFactor {
    LINES("lines", 150, 0.25),                // non-blank, non-comment lines
    FUNCTIONS("functions", 3, 0.20),          // user function definitions
    CUSTOM_TYPES("custom_types", 2, 0.15),    // type definitions
    ARRAY_MATRIX("array_matrix", 8, 0.10),    // array./matrix./map. references
    DRAWING("drawing", 3, 0.05),              // line/label/box/table objects
    NESTING("nesting", 3, 0.10),              // max if-depth
    INDICATORS("indicators", 8, 0.10),        // distinct ta.* calls
    VARIABLES("variables", 20, 0.05);         // distinct variable names

    private final String key;
    private final double defaultSaturation;
    private final double defaultWeight;

    ComplexityFactor(String key, double defaultSaturation, double defaultWeight) {
        this.key = key;
        this.defaultSaturation = defaultSaturation;
        this.defaultWeight = defaultWeight;
    }

    /**
     * Lower-case key used in the AST's factor map.
     */
    public String key() {
        return key;
    }

    public double defaultSaturation() {
        return defaultSaturation;
    }

    public double defaultWeight() {
        return defaultWeight;
    }
}
