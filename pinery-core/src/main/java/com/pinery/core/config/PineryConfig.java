package com.pinery.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pinery.core.script.ComplexityFactor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Conversion pipeline configuration.
 *
 * Passed explicitly to the parser, validator and generator; nothing reads it from a static.
 * Loaded from YAML, every key optional:
 * <pre>
 * complexity:
 *   weights:      { LINES: 0.25, FUNCTIONS: 0.20, ... }
 *   saturation:   { LINES: 150, FUNCTIONS: 3, ... }
 * validation:
 *   ruleBasedMaxScore: 0.3
 *   hybridMaxScore: 0.7
 *   maxNestingDepth: 1
 * generation:
 *   entryConfidence: 0.75
 *   runtimeModule: indicator_runtime
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PineryConfig {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ComplexitySettings complexity = new ComplexitySettings();
    private ValidationSettings validation = new ValidationSettings();
    private GenerationSettings generation = new GenerationSettings();

    public PineryConfig() {
    }

    public static PineryConfig defaults() {
        return new PineryConfig();
    }

    /**
     * Load configuration from a YAML file.
     */
    public static PineryConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Config file not found: " + path);
        }
        PineryConfig config = YAML.readValue(path.toFile(), PineryConfig.class);
        config.complexity.validate();
        return config;
    }

    /**
     * Load configuration from a classpath resource, e.g. "pinery-defaults.yaml".
     */
    public static PineryConfig fromClasspath(String resource) {
        try (InputStream in = PineryConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Config resource not found: " + resource);
            }
            PineryConfig config = YAML.readValue(in, PineryConfig.class);
            config.complexity.validate();
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config resource " + resource, e);
        }
    }

    public ComplexitySettings getComplexity() {
        return complexity;
    }

    public void setComplexity(ComplexitySettings complexity) {
        this.complexity = complexity != null ? complexity : new ComplexitySettings();
    }

    public ValidationSettings getValidation() {
        return validation;
    }

    public void setValidation(ValidationSettings validation) {
        this.validation = validation != null ? validation : new ValidationSettings();
    }

    public GenerationSettings getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationSettings generation) {
        this.generation = generation != null ? generation : new GenerationSettings();
    }

    // ==================== Sections ====================

    /**
     * Per-factor weights and saturation points for the complexity score.
     * Weights must be non-negative so the score stays monotonic in every factor.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ComplexitySettings {

        private Map<ComplexityFactor, Double> weights = new EnumMap<>(ComplexityFactor.class);
        private Map<ComplexityFactor, Double> saturation = new EnumMap<>(ComplexityFactor.class);

        public Map<ComplexityFactor, Double> getWeights() {
            return weights;
        }

        public void setWeights(Map<ComplexityFactor, Double> weights) {
            this.weights = copy(weights);
        }

        public Map<ComplexityFactor, Double> getSaturation() {
            return saturation;
        }

        public void setSaturation(Map<ComplexityFactor, Double> saturation) {
            this.saturation = copy(saturation);
        }

        public double weight(ComplexityFactor factor) {
            return weights.getOrDefault(factor, factor.defaultWeight());
        }

        public double saturation(ComplexityFactor factor) {
            return saturation.getOrDefault(factor, factor.defaultSaturation());
        }

        public ComplexitySettings withWeight(ComplexityFactor factor, double weight) {
            weights.put(factor, weight);
            return this;
        }

        private static Map<ComplexityFactor, Double> copy(Map<ComplexityFactor, Double> source) {
            Map<ComplexityFactor, Double> result = new EnumMap<>(ComplexityFactor.class);
            if (source != null) {
                result.putAll(source);
            }
            return result;
        }

        public void validate() {
            for (ComplexityFactor factor : ComplexityFactor.values()) {
                if (weight(factor) < 0) {
                    throw new IllegalArgumentException("Complexity weight for " + factor + " must be >= 0");
                }
                if (saturation(factor) <= 0) {
                    throw new IllegalArgumentException("Complexity saturation for " + factor + " must be > 0");
                }
            }
        }
    }

    /**
     * Eligibility bands used by the complexity validator.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValidationSettings {

        private double ruleBasedMaxScore = 0.3;
        private double hybridMaxScore = 0.7;
        private int maxNestingDepth = 1;
        private int indicatorWarningCount = 5;

        public double getRuleBasedMaxScore() {
            return ruleBasedMaxScore;
        }

        public void setRuleBasedMaxScore(double ruleBasedMaxScore) {
            this.ruleBasedMaxScore = ruleBasedMaxScore;
        }

        public double getHybridMaxScore() {
            return hybridMaxScore;
        }

        public void setHybridMaxScore(double hybridMaxScore) {
            this.hybridMaxScore = hybridMaxScore;
        }

        public int getMaxNestingDepth() {
            return maxNestingDepth;
        }

        public void setMaxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
        }

        public int getIndicatorWarningCount() {
            return indicatorWarningCount;
        }

        public void setIndicatorWarningCount(int indicatorWarningCount) {
            this.indicatorWarningCount = indicatorWarningCount;
        }
    }

    /**
     * Knobs for the generated Python module.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerationSettings {

        private double entryConfidence = 0.75;
        private double exitConfidence = 0.8;
        private double holdConfidence = 0.5;
        private int defaultMinCandles = 50;
        private int longWarmupMinCandles = 100;
        private String runtimeModule = "indicator_runtime";
        private String runtimeClass = "IndicatorRegistry";
        private boolean emitModuleFunction = true;

        public double getEntryConfidence() {
            return entryConfidence;
        }

        public void setEntryConfidence(double entryConfidence) {
            this.entryConfidence = entryConfidence;
        }

        public double getExitConfidence() {
            return exitConfidence;
        }

        public void setExitConfidence(double exitConfidence) {
            this.exitConfidence = exitConfidence;
        }

        public double getHoldConfidence() {
            return holdConfidence;
        }

        public void setHoldConfidence(double holdConfidence) {
            this.holdConfidence = holdConfidence;
        }

        public int getDefaultMinCandles() {
            return defaultMinCandles;
        }

        public void setDefaultMinCandles(int defaultMinCandles) {
            this.defaultMinCandles = defaultMinCandles;
        }

        public int getLongWarmupMinCandles() {
            return longWarmupMinCandles;
        }

        public void setLongWarmupMinCandles(int longWarmupMinCandles) {
            this.longWarmupMinCandles = longWarmupMinCandles;
        }

        public String getRuntimeModule() {
            return runtimeModule;
        }

        public void setRuntimeModule(String runtimeModule) {
            this.runtimeModule = runtimeModule;
        }

        public String getRuntimeClass() {
            return runtimeClass;
        }

        public void setRuntimeClass(String runtimeClass) {
            this.runtimeClass = runtimeClass;
        }

        public boolean isEmitModuleFunction() {
            return emitModuleFunction;
        }

        public void setEmitModuleFunction(boolean emitModuleFunction) {
            this.emitModuleFunction = emitModuleFunction;
        }
    }
}
