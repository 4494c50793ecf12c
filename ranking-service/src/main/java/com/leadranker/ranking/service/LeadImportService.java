package com.leadranker.ranking.service;

import com.leadranker.ranking.csv.LeadCsvParser;
import com.leadranker.ranking.csv.LeadRow;
import com.leadranker.ranking.model.Lead;
import com.leadranker.ranking.repository.AiCallLogRepository;
import com.leadranker.ranking.repository.LeadRepository;
import com.leadranker.ranking.repository.PromptRepository;
import com.leadranker.ranking.repository.RankingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/** Write side of the leads screen: CSV import and full reset. */
@Service
public class LeadImportService {

    private static final Logger log = LoggerFactory.getLogger(LeadImportService.class);

    static final int INSERT_BATCH_SIZE = 50;

    static final String EXPECTED_HEADER = "account_name, lead_first_name, lead_last_name, lead_job_title, "
        + "account_domain, account_employee_range, account_industry";

    private final LeadRepository leadRepository;
    private final RankingRepository rankingRepository;
    private final PromptRepository promptRepository;
    private final AiCallLogRepository aiCallLogRepository;

    public LeadImportService(LeadRepository leadRepository,
                             RankingRepository rankingRepository,
                             PromptRepository promptRepository,
                             AiCallLogRepository aiCallLogRepository) {
        this.leadRepository      = leadRepository;
        this.rankingRepository   = rankingRepository;
        this.promptRepository    = promptRepository;
        this.aiCallLogRepository = aiCallLogRepository;
    }

    /**
     * Replaces all leads (and their rankings) with the rows of {@code csv}.
     *
     * @return number of imported leads
     */
    @Transactional
    public Mono<Integer> importCsv(String csv) {
        return Mono.fromCallable(() -> {
                List<LeadRow> rows = LeadCsvParser.parse(csv);
                if (rows.isEmpty()) {
                    throw new IllegalArgumentException("CSV has no data rows. Expected header: " + EXPECTED_HEADER);
                }
                return rows;
            })
            .flatMap(rows -> rankingRepository.deleteAll()
                .then(leadRepository.deleteAll())
                .thenMany(Flux.fromIterable(rows)
                    .map(LeadImportService::toEntity)
                    .buffer(INSERT_BATCH_SIZE)
                    .concatMap(leadRepository::saveAll))
                .then()
                .thenReturn(rows.size()))
            .doOnSuccess(n -> log.info("[LeadImport] Leads imported. count={}", n));
    }

    /** Deletes call logs, rankings, leads and prompts, in that order. */
    @Transactional
    public Mono<Void> clearAll() {
        return aiCallLogRepository.deleteAll()
            .then(rankingRepository.deleteAll())
            .then(leadRepository.deleteAll())
            .then(promptRepository.deleteAll())
            .doOnSuccess(v -> log.info("[LeadImport] All data cleared."));
    }

    private static Lead toEntity(LeadRow row) {
        Lead lead = new Lead();
        lead.setAccountName(row.accountName());
        lead.setFirstName(row.firstName());
        lead.setLastName(row.lastName());
        lead.setJobTitle(row.jobTitle());
        lead.setAccountDomain(row.accountDomain());
        lead.setEmployeeRange(row.employeeRange());
        lead.setIndustry(row.industry());
        lead.setCreatedAt(LocalDateTime.now());
        return lead;
    }
}
