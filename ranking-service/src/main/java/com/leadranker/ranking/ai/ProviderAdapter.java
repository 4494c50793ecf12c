package com.leadranker.ranking.ai;

import reactor.core.publisher.Mono;

import java.util.List;

/** One wire dialect. Registered with {@link AiChatGateway} by provider. */
public interface ProviderAdapter {

    AiProvider provider();

    boolean isConfigured();

    Mono<ChatCompletion> chat(List<ChatMessage> messages, ChatOptions options);
}
