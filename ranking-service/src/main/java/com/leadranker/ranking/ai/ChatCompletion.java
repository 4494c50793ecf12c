package com.leadranker.ranking.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provider-agnostic result of one chat call, tagged with the provider that
 * produced it. {@code cost} is in USD.
 */
public record ChatCompletion(
    @JsonProperty("content")      String     content,
    @JsonProperty("inputTokens")  int        inputTokens,
    @JsonProperty("outputTokens") int        outputTokens,
    @JsonProperty("model")        String     model,
    @JsonProperty("provider")     AiProvider provider,
    @JsonProperty("cost")         double     cost,
    @JsonProperty("durationMs")   long       durationMs
) {
    public static ChatCompletion of(AiProvider provider, String model, String content,
                                    int inputTokens, int outputTokens, long startedAtMs) {
        return new ChatCompletion(content, inputTokens, outputTokens, model, provider,
            ModelPricing.cost(provider, model, inputTokens, outputTokens),
            System.currentTimeMillis() - startedAtMs);
    }
}
