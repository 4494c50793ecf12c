package com.leadranker.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optimizer start request. {@code sessionId} and {@code csv} are used by the
 * session endpoint only; the canonical endpoint ignores them.
 */
public record StartOptimizationRequest(
    @JsonProperty("provider")       String  provider,
    @JsonProperty("populationSize") Integer populationSize,
    @JsonProperty("generations")    Integer generations,
    @JsonProperty("sampleSize")     Integer sampleSize,
    @JsonProperty("sessionId")      String  sessionId,
    @JsonProperty("csv")            String  csv
) {}
