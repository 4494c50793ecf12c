package com.leadranker.ranking.store;

import com.leadranker.ranking.model.AiCallLog;
import com.leadranker.ranking.repository.AiCallLogRepository;
import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Component
public class R2dbcAiCallLogStore implements AiCallLogStore {

    private static final String SUMMARY_COLUMNS = """
        SELECT COUNT(*)                          AS total_calls,
               COALESCE(SUM(cost), 0)            AS total_cost,
               COALESCE(SUM(input_tokens), 0)    AS total_input_tokens,
               COALESCE(SUM(output_tokens), 0)   AS total_output_tokens,
               COALESCE(AVG(duration_ms), 0)     AS avg_duration_ms
        FROM ai_call_logs
        """;

    private final AiCallLogRepository repository;
    private final DatabaseClient databaseClient;

    public R2dbcAiCallLogStore(AiCallLogRepository repository, DatabaseClient databaseClient) {
        this.repository     = repository;
        this.databaseClient = databaseClient;
    }

    @Override
    public Mono<Void> append(AiCallRecord record) {
        AiCallLog entity = new AiCallLog();
        entity.setProvider(record.provider());
        entity.setModel(record.model());
        entity.setInputTokens(record.inputTokens());
        entity.setOutputTokens(record.outputTokens());
        entity.setCost(record.cost());
        entity.setDurationMs(record.durationMs());
        entity.setPromptVersion(record.promptVersion());
        entity.setBatchId(record.batchId());
        entity.setCreatedAt(LocalDateTime.now());
        return repository.save(entity).then();
    }

    @Override
    public Mono<CostSummary> summarize(Collection<String> batchIds) {
        if (batchIds == null) {
            return databaseClient.sql(SUMMARY_COLUMNS)
                .map(R2dbcAiCallLogStore::toSummary)
                .one()
                .defaultIfEmpty(CostSummary.empty());
        }
        // IN () with an empty list is not valid SQL
        if (batchIds.isEmpty()) {
            return Mono.just(CostSummary.empty());
        }
        return databaseClient.sql(SUMMARY_COLUMNS + " WHERE batch_id IN (:batchIds)")
            .bind("batchIds", batchIds)
            .map(R2dbcAiCallLogStore::toSummary)
            .one()
            .defaultIfEmpty(CostSummary.empty());
    }

    private static CostSummary toSummary(Readable row) {
        return new CostSummary(
            number(row, "total_calls").longValue(),
            number(row, "total_cost").doubleValue(),
            number(row, "total_input_tokens").longValue(),
            number(row, "total_output_tokens").longValue(),
            number(row, "avg_duration_ms").doubleValue());
    }

    private static Number number(Readable row, String column) {
        Number value = row.get(column, Number.class);
        return value != null ? value : 0;
    }
}
