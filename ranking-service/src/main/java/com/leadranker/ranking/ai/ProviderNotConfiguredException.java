package com.leadranker.ranking.ai;

/** Raised before any run starts when the requested provider has no API key. */
public class ProviderNotConfiguredException extends RuntimeException {
    private final AiProvider provider;

    public ProviderNotConfiguredException(AiProvider provider) {
        super(provider.wireName() + " API key not configured");
        this.provider = provider;
    }

    public AiProvider getProvider() {
        return provider;
    }
}
