package com.leadranker.ranking.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record PromptVersion(
    @JsonProperty("version")       int           version,
    @JsonProperty("content")       String        content,
    @JsonProperty("evalScore")     Double        evalScore,
    @JsonProperty("isActive")      boolean       active,
    @JsonProperty("generation")    Integer       generation,
    @JsonProperty("parentVersion") Integer       parentVersion,
    @JsonProperty("createdAt")     LocalDateTime createdAt
) {
    public static PromptVersion draft(int version, String content, Double evalScore, boolean active,
                                      Integer generation, Integer parentVersion) {
        return new PromptVersion(version, content, evalScore, active, generation, parentVersion, null);
    }
}
