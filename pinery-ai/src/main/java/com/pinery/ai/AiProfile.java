package com.pinery.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Named LLM profile containing all provider settings.
 * Prices are per million tokens and only feed cost estimates.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiProfile {

    private String id;
    private String name;
    private String description;
    private AiProvider provider = AiProvider.CLAUDE;
    private int timeoutSeconds = 60;

    // CLI providers (CLAUDE, CODEX)
    private String path = "claude";
    private String args = "--print --output-format text";

    // Custom provider
    private String command = "";

    // Gemini provider
    private String apiKey = "";
    private String model = "gemini-2.5-flash";

    // Pricing, USD per million tokens
    private double inputCostPerMillion = 3.0;
    private double outputCostPerMillion = 15.0;

    public AiProfile() {
    }

    public AiProfile(String id, String name, AiProvider provider) {
        this.id = id;
        this.name = name;
        this.provider = provider;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public AiProvider getProvider() {
        return provider;
    }

    public void setProvider(AiProvider provider) {
        this.provider = provider;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getArgs() {
        return args;
    }

    public void setArgs(String args) {
        this.args = args;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getInputCostPerMillion() {
        return inputCostPerMillion;
    }

    public void setInputCostPerMillion(double inputCostPerMillion) {
        this.inputCostPerMillion = inputCostPerMillion;
    }

    public double getOutputCostPerMillion() {
        return outputCostPerMillion;
    }

    public void setOutputCostPerMillion(double outputCostPerMillion) {
        this.outputCostPerMillion = outputCostPerMillion;
    }

    @Override
    public String toString() {
        return name != null ? name : id;
    }
}
