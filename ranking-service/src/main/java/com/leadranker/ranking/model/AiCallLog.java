package com.leadranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** Cost and latency of one LLM call. Append-only. */
@Data
@NoArgsConstructor
@Table("ai_call_logs")
public class AiCallLog {

    @Id
    private Long id;

    private String provider;

    private String model;

    private Integer inputTokens;

    private Integer outputTokens;

    private Double cost;

    private Long durationMs;

    private Integer promptVersion;

    /** Ranking batch id or optimizer run id. */
    private String batchId;

    private LocalDateTime createdAt;
}
