package com.leadranker.ranking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.ai.AnthropicAdapter;
import com.leadranker.ranking.ai.OpenAiCompatibleAdapter;
import com.leadranker.ranking.ai.ProviderAdapter;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class AiClientConfig {

    @Value("${ai.timeout-seconds:120}")
    private int timeoutSeconds;

    @Bean
    public ProviderAdapter openAiAdapter(WebClient.Builder builder, ObjectMapper objectMapper,
                                         @Value("${ai.openai.base-url:https://api.openai.com/v1}") String baseUrl,
                                         @Value("${ai.openai.api-key:}") String apiKey,
                                         @Value("${ai.openai.model:gpt-4o-mini}") String model) {
        return new OpenAiCompatibleAdapter(AiProvider.OPENAI, client(builder, baseUrl), objectMapper,
                                           apiKey, model, timeout());
    }

    @Bean
    public ProviderAdapter openRouterAdapter(WebClient.Builder builder, ObjectMapper objectMapper,
                                             @Value("${ai.openrouter.base-url:https://openrouter.ai/api/v1}") String baseUrl,
                                             @Value("${ai.openrouter.api-key:}") String apiKey,
                                             @Value("${ai.openrouter.model:openai/gpt-4o-mini}") String model) {
        return new OpenAiCompatibleAdapter(AiProvider.OPENROUTER, client(builder, baseUrl), objectMapper,
                                           apiKey, model, timeout());
    }

    @Bean
    public ProviderAdapter anthropicAdapter(WebClient.Builder builder, ObjectMapper objectMapper,
                                            @Value("${ai.anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                                            @Value("${ai.anthropic.api-key:}") String apiKey,
                                            @Value("${ai.anthropic.model:claude-sonnet-4-20250514}") String model) {
        return new AnthropicAdapter(client(builder, baseUrl), objectMapper, apiKey, model, timeout());
    }

    private Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    // builder.clone(): the injected builder is shared between beans
    private WebClient client(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(timeout())
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(errorStatusFilter())
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction errorStatusFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                return clientResponse.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> Mono.error(new IllegalStateException(
                        "Provider responded " + clientResponse.statusCode().value() + ": " + body)));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String auth = clientRequest.headers().containsKey(HttpHeaders.AUTHORIZATION)
                       || clientRequest.headers().containsKey("x-api-key") ? "***" : "none";
            LoggerFactory.getLogger(AiClientConfig.class)
                .debug("Outbound request: {} {} auth={}", clientRequest.method(), clientRequest.url(), auth);
            return Mono.just(clientRequest);
        });
    }
}
