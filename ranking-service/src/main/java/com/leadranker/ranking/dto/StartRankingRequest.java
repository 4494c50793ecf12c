package com.leadranker.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Both fields optional; the provider defaults to {@code ai.default-provider}. */
public record StartRankingRequest(
    @JsonProperty("provider")  String provider,
    @JsonProperty("sessionId") String sessionId
) {}
