package com.leadranker.ranking.store;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CostSummary(
    @JsonProperty("totalCalls")        long   totalCalls,
    @JsonProperty("totalCost")         double totalCost,
    @JsonProperty("totalInputTokens")  long   totalInputTokens,
    @JsonProperty("totalOutputTokens") long   totalOutputTokens,
    @JsonProperty("avgDurationMs")     double avgDurationMs
) {
    public static CostSummary empty() {
        return new CostSummary(0, 0.0, 0, 0, 0.0);
    }
}
