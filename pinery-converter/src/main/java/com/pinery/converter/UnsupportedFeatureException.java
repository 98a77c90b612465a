package com.pinery.converter;

import java.util.List;

/**
 * Script uses features the rule-based path never translates: custom functions, custom types,
 * array/matrix operations or other unsupported constructs.
 */
public class UnsupportedFeatureException extends ConverterException {

    private final List<String> features;
    private final List<String> reasons;

    public UnsupportedFeatureException(String message, List<String> features, List<String> reasons) {
        super(message);
        this.features = List.copyOf(features);
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getFeatures() {
        return features;
    }

    public List<String> getReasons() {
        return reasons;
    }
}
