package com.leadranker.ranking.ai;

import java.util.Map;

/**
 * Static USD price table per million tokens. Unknown models are billed at
 * {@link #FALLBACK}.
 */
public final class ModelPricing {

    record Price(double inputPerMillion, double outputPerMillion) {}

    static final Price FALLBACK = new Price(3.0, 15.0);

    private static final Map<AiProvider, Map<String, Price>> PRICES = Map.of(
        AiProvider.OPENAI, Map.of(
            "gpt-4o",       new Price(2.5, 10.0),
            "gpt-4o-mini",  new Price(0.15, 0.6),
            "gpt-4-turbo",  new Price(10.0, 30.0)),
        AiProvider.ANTHROPIC, Map.of(
            "claude-sonnet-4-20250514",   new Price(3.0, 15.0),
            "claude-3-5-sonnet-20241022", new Price(3.0, 15.0),
            "claude-3-haiku-20240307",    new Price(0.25, 1.25)),
        AiProvider.OPENROUTER, Map.of(
            "openai/gpt-4o-mini",          new Price(0.15, 0.6),
            "openai/gpt-4o",               new Price(2.5, 10.0),
            "anthropic/claude-3-5-sonnet", new Price(3.0, 15.0),
            "anthropic/claude-3-haiku",    new Price(0.25, 1.25))
    );

    private ModelPricing() {}

    public static double cost(AiProvider provider, String model, int inputTokens, int outputTokens) {
        Price price = PRICES.getOrDefault(provider, Map.of()).getOrDefault(model, FALLBACK);
        return (inputTokens * price.inputPerMillion() + outputTokens * price.outputPerMillion()) / 1_000_000.0;
    }
}
