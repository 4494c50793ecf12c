package com.leadranker.ranking.store;

import com.leadranker.common.model.LeadForRanking;
import com.leadranker.ranking.model.Lead;
import com.leadranker.ranking.model.Ranking;
import com.leadranker.ranking.repository.LeadRepository;
import com.leadranker.ranking.repository.RankingRepository;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

@Component
public class R2dbcLeadRankingStore implements LeadRankingStore {

    private final LeadRepository leadRepository;
    private final RankingRepository rankingRepository;

    public R2dbcLeadRankingStore(LeadRepository leadRepository, RankingRepository rankingRepository) {
        this.leadRepository    = leadRepository;
        this.rankingRepository = rankingRepository;
    }

    @Override
    public Flux<LeadForRanking> findAllLeads() {
        return leadRepository.findAllByOrderByIdAsc().map(R2dbcLeadRankingStore::toLeadForRanking);
    }

    @Override
    public Flux<LeadRank> findCurrentRanks() {
        return rankingRepository.findAll()
            .map(r -> new LeadRank(String.valueOf(r.getLeadId()), r.getRank()));
    }

    @Override
    public Mono<Void> deleteAllRankings() {
        return rankingRepository.deleteAll();
    }

    @Override
    public Mono<Void> saveRankings(List<RankingRecord> rankings) {
        if (rankings.isEmpty()) return Mono.empty();
        return rankingRepository.saveAll(rankings.stream().map(R2dbcLeadRankingStore::toEntity).toList())
            .then();
    }

    static LeadForRanking toLeadForRanking(Lead lead) {
        return new LeadForRanking(String.valueOf(lead.getId()), lead.getFirstName(), lead.getLastName(),
            lead.getJobTitle(), lead.getAccountName(), lead.getEmployeeRange(), lead.getIndustry());
    }

    private static Ranking toEntity(RankingRecord record) {
        Ranking entity = new Ranking();
        entity.setLeadId(Long.valueOf(record.leadId()));
        entity.setRank(record.rank());
        entity.setRelevanceScore(record.relevanceScore());
        entity.setReasoning(record.reasoning());
        entity.setPromptVersion(record.promptVersion());
        entity.setCreatedAt(LocalDateTime.now());
        return entity;
    }
}
