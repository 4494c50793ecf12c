package com.leadranker.ranking.service;

import com.leadranker.ranking.dto.LeadListQuery;
import com.leadranker.ranking.dto.LeadPage;
import com.leadranker.ranking.dto.LeadView;
import com.leadranker.ranking.dto.RankingStats;
import com.leadranker.ranking.session.SessionStateStore;
import com.leadranker.ranking.store.AiCallLogStore;
import com.leadranker.ranking.store.CostSummary;
import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read side of the leads screen: the ranked lead list and the summary counters.
 */
@Service
public class LeadQueryService {

    private static final String LEADS_JOIN = """
        FROM leads l
        LEFT JOIN rankings r ON r.lead_id = l.id
        """;

    private static final String RELEVANT_ONLY = " WHERE r.rank IS NOT NULL";

    private final DatabaseClient databaseClient;
    private final AiCallLogStore aiCallLogStore;
    private final SessionStateStore sessionStore;

    public LeadQueryService(DatabaseClient databaseClient, AiCallLogStore aiCallLogStore,
                            SessionStateStore sessionStore) {
        this.databaseClient = databaseClient;
        this.aiCallLogStore = aiCallLogStore;
        this.sessionStore   = sessionStore;
    }

    public Mono<LeadPage> listLeads(LeadListQuery query) {
        String filter = query.showIrrelevant() ? "" : RELEVANT_ONLY;

        Mono<Long> total = databaseClient.sql("SELECT COUNT(*) AS total " + LEADS_JOIN + filter)
            .map(row -> count(row, "total"))
            .one()
            .defaultIfEmpty(0L);

        Mono<List<LeadView>> page = databaseClient.sql("""
                SELECT l.id, l.first_name, l.last_name, l.job_title, l.account_name, l.account_domain,
                       l.employee_range, l.industry, r.rank, r.reasoning, r.relevance_score
                """ + LEADS_JOIN + filter
                + " ORDER BY " + query.orderByClause()
                + " LIMIT :limit OFFSET :offset")
            .bind("limit", query.pageSize())
            .bind("offset", query.offset())
            .map(LeadQueryService::toView)
            .all()
            .collectList();

        return Mono.zip(page, total)
            .map(t -> new LeadPage(t.getT1(), LeadPage.Pagination.of(query.page(), query.pageSize(), t.getT2())));
    }

    /**
     * Lead counters plus LLM call aggregates. With a session id the aggregates
     * cover only the runs that session started.
     */
    public Mono<RankingStats> getRankingStats(String sessionId) {
        Mono<long[]> counts = databaseClient.sql("""
                SELECT (SELECT COUNT(*) FROM leads)                             AS total_leads,
                       (SELECT COUNT(*) FROM rankings)                          AS ranked_leads,
                       (SELECT COUNT(*) FROM rankings WHERE rank IS NOT NULL)   AS relevant_leads
                """)
            .map(row -> new long[] {
                count(row, "total_leads"), count(row, "ranked_leads"), count(row, "relevant_leads") })
            .one()
            .defaultIfEmpty(new long[] {0, 0, 0});

        Mono<CostSummary> calls = aiCallLogStore.summarize(
            sessionId == null || sessionId.isBlank() ? null : sessionStore.getBatchIds(sessionId));

        return Mono.zip(counts, calls)
            .map(t -> {
                long[] c = t.getT1();
                return new RankingStats(c[0], c[1], c[2], c[1] - c[2], t.getT2());
            });
    }

    private static LeadView toView(Readable row) {
        Number score = row.get("relevance_score", Number.class);
        return new LeadView(
            String.valueOf(row.get("id", Long.class)),
            row.get("first_name", String.class),
            row.get("last_name", String.class),
            row.get("job_title", String.class),
            row.get("account_name", String.class),
            row.get("account_domain", String.class),
            row.get("employee_range", String.class),
            row.get("industry", String.class),
            row.get("rank", Integer.class),
            row.get("reasoning", String.class),
            score != null ? score.doubleValue() : null);
    }

    private static long count(Readable row, String column) {
        Number value = row.get(column, Number.class);
        return value != null ? value.longValue() : 0L;
    }
}
