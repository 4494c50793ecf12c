package com.leadranker.ranking.support;

import com.leadranker.ranking.store.AiCallLogStore;
import com.leadranker.ranking.store.AiCallRecord;
import com.leadranker.ranking.store.CostSummary;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryAiCallLogStore implements AiCallLogStore {

    public final List<AiCallRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> append(AiCallRecord record) {
        return Mono.fromRunnable(() -> records.add(record));
    }

    @Override
    public Mono<CostSummary> summarize(Collection<String> batchIds) {
        List<AiCallRecord> selected = records.stream()
            .filter(r -> batchIds == null || batchIds.contains(r.batchId()))
            .toList();
        return Mono.just(new CostSummary(
            selected.size(),
            selected.stream().mapToDouble(AiCallRecord::cost).sum(),
            selected.stream().mapToLong(AiCallRecord::inputTokens).sum(),
            selected.stream().mapToLong(AiCallRecord::outputTokens).sum(),
            selected.stream().mapToLong(AiCallRecord::durationMs).average().orElse(0.0)));
    }
}
