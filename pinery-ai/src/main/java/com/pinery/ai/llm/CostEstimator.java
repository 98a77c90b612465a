package com.pinery.ai.llm;

import com.pinery.ai.AiProfile;

/**
 * Character-based token estimates priced with a profile's per-million-token rates.
 * One token is taken as four characters; generated code is expected to run 2.5 times the prompt.
 */
public class CostEstimator {

    public static final int CHARS_PER_TOKEN = 4;
    public static final double OUTPUT_RATIO = 2.5;

    private final double inputCostPerMillion;
    private final double outputCostPerMillion;

    public CostEstimator(double inputCostPerMillion, double outputCostPerMillion) {
        this.inputCostPerMillion = inputCostPerMillion;
        this.outputCostPerMillion = outputCostPerMillion;
    }

    public static CostEstimator forProfile(AiProfile profile) {
        return new CostEstimator(profile.getInputCostPerMillion(), profile.getOutputCostPerMillion());
    }

    public static long tokens(String text) {
        return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
    }

    /**
     * Estimate before sending: output tokens derived from the prompt size.
     */
    public CostEstimate estimate(String prompt) {
        long input = tokens(prompt);
        long output = Math.round(input * OUTPUT_RATIO);
        return price(input, output);
    }

    /**
     * Estimate after the answer came back, from both texts.
     */
    public CostEstimate actual(String prompt, String response) {
        return price(tokens(prompt), tokens(response));
    }

    private CostEstimate price(long input, long output) {
        double cost = input * inputCostPerMillion / 1_000_000 + output * outputCostPerMillion / 1_000_000;
        return new CostEstimate(input, output, cost);
    }
}
