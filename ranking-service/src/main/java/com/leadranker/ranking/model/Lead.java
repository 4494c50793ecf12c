package com.leadranker.ranking.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One imported prospect.
 *
 * Column mapping (R2DBC snake_case convention):
 *   accountName   → account_name
 *   firstName     → first_name
 *   lastName      → last_name
 *   jobTitle      → job_title
 *   accountDomain → account_domain
 *   employeeRange → employee_range
 */
@Data
@NoArgsConstructor
@Table("leads")
public class Lead {

    @Id
    private Long id;

    private String accountName;

    private String firstName;

    private String lastName;

    private String jobTitle;

    private String accountDomain;

    private String employeeRange;

    private String industry;

    private LocalDateTime createdAt;
}
