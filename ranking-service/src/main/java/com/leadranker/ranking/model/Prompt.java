package com.leadranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A versioned ranking prompt. At most one row has {@code is_active = true}.
 */
@Data
@NoArgsConstructor
@Table("prompts")
public class Prompt {

    @Id
    private Long id;

    private Integer version;

    private String content;

    private Double evalScore;

    @Column("is_active")
    private Boolean active;

    private Integer generation;

    private Integer parentVersion;

    private LocalDateTime createdAt;
}
