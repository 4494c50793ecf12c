package com.leadranker.ranking.ai;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The only way the ranking and optimizer code reaches a model. Implementations
 * must fail with {@link ProviderNotConfiguredException} for providers without
 * a credential.
 */
public interface AiChatClient {

    Mono<ChatCompletion> chat(AiProvider provider, List<ChatMessage> messages, ChatOptions options);

    boolean isConfigured(AiProvider provider);

    List<AiProvider> availableProviders();

    /** Synchronous configuration check for request handlers. */
    default void requireConfigured(AiProvider provider) {
        if (!isConfigured(provider)) {
            throw new ProviderNotConfiguredException(provider);
        }
    }
}
