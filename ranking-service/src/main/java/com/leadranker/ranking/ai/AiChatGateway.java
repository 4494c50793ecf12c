package com.leadranker.ranking.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes chat calls to the adapter registered for the requested provider.
 */
@Service
public class AiChatGateway implements AiChatClient {

    private static final Logger log = LoggerFactory.getLogger(AiChatGateway.class);

    private final Map<AiProvider, ProviderAdapter> adapters = new EnumMap<>(AiProvider.class);

    public AiChatGateway(List<ProviderAdapter> adapters) {
        adapters.forEach(a -> this.adapters.put(a.provider(), a));
        log.info("[AiGateway] Providers registered. configured={}", availableProviders());
    }

    @Override
    public Mono<ChatCompletion> chat(AiProvider provider, List<ChatMessage> messages, ChatOptions options) {
        ProviderAdapter adapter = adapters.get(provider);
        if (adapter == null || !adapter.isConfigured()) {
            return Mono.error(new ProviderNotConfiguredException(provider));
        }
        return adapter.chat(messages, options != null ? options : ChatOptions.defaults());
    }

    @Override
    public boolean isConfigured(AiProvider provider) {
        ProviderAdapter adapter = adapters.get(provider);
        return adapter != null && adapter.isConfigured();
    }

    @Override
    public List<AiProvider> availableProviders() {
        return Arrays.stream(AiProvider.values())
            .filter(this::isConfigured)
            .toList();
    }
}
