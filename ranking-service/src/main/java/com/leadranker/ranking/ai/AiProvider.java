package com.leadranker.ranking.ai;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Closed set of chat providers the gateway can route to. */
public enum AiProvider {
    OPENAI, ANTHROPIC, OPENROUTER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup by wire name.
     *
     * @throws IllegalArgumentException for unknown provider names
     */
    @JsonCreator
    public static AiProvider fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown AI provider: " + value, e);
        }
    }
}
