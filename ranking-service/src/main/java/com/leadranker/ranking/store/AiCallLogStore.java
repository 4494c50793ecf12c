package com.leadranker.ranking.store;

import reactor.core.publisher.Mono;

import java.util.Collection;

public interface AiCallLogStore {

    Mono<Void> append(AiCallRecord record);

    /**
     * Aggregates calls whose batch id is in {@code batchIds}; a null
     * collection aggregates every call.
     */
    Mono<CostSummary> summarize(Collection<String> batchIds);
}
