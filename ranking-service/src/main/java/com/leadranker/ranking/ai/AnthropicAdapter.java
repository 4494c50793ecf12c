package com.leadranker.ranking.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Anthropic Messages API dialect. System messages are lifted into the
 * top-level {@code system} field; the Messages API has no JSON response mode,
 * so {@code jsonMode} relies on the prompt's own output contract.
 */
public class AnthropicAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(AnthropicAdapter.class);

    static final String API_VERSION = "2023-06-01";

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String defaultModel;
    private final Duration timeout;

    public AnthropicAdapter(WebClient client, ObjectMapper objectMapper,
                            String apiKey, String defaultModel, Duration timeout) {
        this.client       = client;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.defaultModel = defaultModel;
        this.timeout      = timeout;
    }

    @Override
    public AiProvider provider() {
        return AiProvider.ANTHROPIC;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<ChatCompletion> chat(List<ChatMessage> messages, ChatOptions options) {
        if (!isConfigured()) {
            return Mono.error(new ProviderNotConfiguredException(provider()));
        }
        String model = options.modelOr(defaultModel);
        long startedAt = System.currentTimeMillis();

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(model, messages, options)))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
            )
            .map(response -> toCompletion(response, model, startedAt))
            .doOnSuccess(c -> log.debug("[Anthropic] Call completed. model={} in={} out={} durationMs={}",
                                        model, c.inputTokens(), c.outputTokens(), c.durationMs()))
            .onErrorMap(e -> !(e instanceof LlmCallException),
                        e -> new LlmCallException(provider(), e.getMessage(), e));
    }

    private Map<String, Object> requestBody(String model, List<ChatMessage> messages, ChatOptions options) {
        String system = messages.stream()
            .filter(ChatMessage::isSystem)
            .map(ChatMessage::content)
            .collect(Collectors.joining("\n\n"));
        List<Map<String, String>> turns = messages.stream()
            .filter(m -> !m.isSystem())
            .map(m -> Map.of("role", m.role(), "content", m.content()))
            .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", options.maxTokensOrDefault());
        body.put("temperature", options.temperatureOrDefault());
        if (!system.isEmpty()) {
            body.put("system", system);
        }
        body.put("messages", turns);
        return body;
    }

    private ChatCompletion toCompletion(String response, String model, long startedAt) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode first = root.path("content").path(0);
            String text = "text".equals(first.path("type").asText("text")) ? first.path("text").asText("") : "";
            JsonNode usage = root.path("usage");
            return ChatCompletion.of(provider(), model, text,
                usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0), startedAt);
        } catch (Exception e) {
            throw new LlmCallException(provider(), "Failed to extract text from Anthropic response", e);
        }
    }
}
