package com.leadranker.ranking.ai;

/** Transport or payload failure of a single provider call. */
public class LlmCallException extends RuntimeException {
    private final AiProvider provider;

    public LlmCallException(AiProvider provider, String message, Throwable cause) {
        super("[" + provider.wireName() + "] " + message, cause);
        this.provider = provider;
    }

    public AiProvider getProvider() {
        return provider;
    }
}
