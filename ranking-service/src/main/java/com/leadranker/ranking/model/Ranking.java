package com.leadranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Current ranking of a lead. {@code rank} is null for irrelevant leads;
 * the table is wiped at the start of every ranking batch.
 */
@Data
@NoArgsConstructor
@Table("rankings")
public class Ranking {

    @Id
    private Long id;

    private Long leadId;

    private Integer rank;

    private Double relevanceScore;

    private String reasoning;

    private Integer promptVersion;

    private LocalDateTime createdAt;
}
