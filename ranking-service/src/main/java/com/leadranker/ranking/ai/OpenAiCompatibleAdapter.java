package com.leadranker.ranking.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat Completions dialect shared by OpenAI and OpenRouter; the two differ
 * only in base URL, key and default model.
 */
public class OpenAiCompatibleAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleAdapter.class);

    private final AiProvider provider;
    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String defaultModel;
    private final Duration timeout;

    public OpenAiCompatibleAdapter(AiProvider provider, WebClient client, ObjectMapper objectMapper,
                                   String apiKey, String defaultModel, Duration timeout) {
        this.provider     = provider;
        this.client       = client;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.defaultModel = defaultModel;
        this.timeout      = timeout;
    }

    @Override
    public AiProvider provider() {
        return provider;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<ChatCompletion> chat(List<ChatMessage> messages, ChatOptions options) {
        if (!isConfigured()) {
            return Mono.error(new ProviderNotConfiguredException(provider));
        }
        String model = options.modelOr(defaultModel);
        long startedAt = System.currentTimeMillis();

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(model, messages, options)))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
            )
            .map(response -> toCompletion(response, model, startedAt))
            .doOnSuccess(c -> log.debug("[{}] Call completed. model={} in={} out={} durationMs={}",
                                        provider.wireName(), model, c.inputTokens(), c.outputTokens(), c.durationMs()))
            .onErrorMap(e -> !(e instanceof LlmCallException),
                        e -> new LlmCallException(provider, e.getMessage(), e));
    }

    private Map<String, Object> requestBody(String model, List<ChatMessage> messages, ChatOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages.stream()
            .map(m -> Map.of("role", m.role(), "content", m.content()))
            .toList());
        body.put("temperature", options.temperatureOrDefault());
        body.put("max_tokens", options.maxTokensOrDefault());
        if (options.jsonMode()) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        return body;
    }

    private ChatCompletion toCompletion(String response, String model, long startedAt) {
        try {
            JsonNode root = objectMapper.readTree(response);
            String text = root.path("choices").path(0).path("message").path("content").asText("");
            JsonNode usage = root.path("usage");
            return ChatCompletion.of(provider, model, text,
                usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0), startedAt);
        } catch (Exception e) {
            throw new LlmCallException(provider, "Failed to extract text from chat completion response", e);
        }
    }
}
