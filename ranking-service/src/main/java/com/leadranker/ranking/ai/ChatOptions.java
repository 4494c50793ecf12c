package com.leadranker.ranking.ai;

/**
 * Per-call overrides. Every field is optional; adapters fall back to
 * {@link #DEFAULT_TEMPERATURE}, {@link #DEFAULT_MAX_TOKENS} and their
 * configured model.
 */
public record ChatOptions(String model, Double temperature, Integer maxTokens, boolean jsonMode) {

    public static final double DEFAULT_TEMPERATURE = 0.3;
    public static final int    DEFAULT_MAX_TOKENS  = 4096;

    /** Output budget for ranking a group of leads: about 220 tokens of reasoning per lead. */
    public static int maxTokensForLeads(int leadCount) {
        return Math.max(DEFAULT_MAX_TOKENS, 400 + 220 * leadCount);
    }

    public static ChatOptions defaults() {
        return new ChatOptions(null, null, null, false);
    }

    public static ChatOptions json(double temperature, int maxTokens) {
        return new ChatOptions(null, temperature, maxTokens, true);
    }

    public static ChatOptions text(double temperature, int maxTokens) {
        return new ChatOptions(null, temperature, maxTokens, false);
    }

    public double temperatureOrDefault() {
        return temperature != null ? temperature : DEFAULT_TEMPERATURE;
    }

    public int maxTokensOrDefault() {
        return maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
    }

    public String modelOr(String fallback) {
        return model != null && !model.isBlank() ? model : fallback;
    }
}
