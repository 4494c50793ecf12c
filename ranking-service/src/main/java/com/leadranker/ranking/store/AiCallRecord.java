package com.leadranker.ranking.store;

import com.leadranker.ranking.ai.ChatCompletion;

/** One row of the LLM cost log. {@code promptVersion} is null for optimizer calls. */
public record AiCallRecord(String provider, String model, int inputTokens, int outputTokens,
                           double cost, long durationMs, Integer promptVersion, String batchId) {

    public static AiCallRecord of(ChatCompletion completion, String batchId, Integer promptVersion) {
        return new AiCallRecord(completion.provider().wireName(), completion.model(),
            completion.inputTokens(), completion.outputTokens(), completion.cost(),
            completion.durationMs(), promptVersion, batchId);
    }
}
