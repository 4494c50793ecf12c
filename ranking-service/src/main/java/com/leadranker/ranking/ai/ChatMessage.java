package com.leadranker.ranking.ai;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatMessage(
    @JsonProperty("role")    String role,
    @JsonProperty("content") String content
) {
    public static final String SYSTEM    = "system";
    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    public boolean isSystem() {
        return SYSTEM.equals(role);
    }
}
