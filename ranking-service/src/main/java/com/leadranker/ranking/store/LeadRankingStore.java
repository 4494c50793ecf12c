package com.leadranker.ranking.store;

import com.leadranker.common.model.LeadForRanking;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/** Lead and ranking persistence as seen by the ranking batch. */
public interface LeadRankingStore {

    Flux<LeadForRanking> findAllLeads();

    Flux<LeadRank> findCurrentRanks();

    Mono<Void> deleteAllRankings();

    Mono<Void> saveRankings(List<RankingRecord> rankings);
}
