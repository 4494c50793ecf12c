package com.leadranker.ranking.repository;

import com.leadranker.ranking.model.Ranking;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RankingRepository extends ReactiveCrudRepository<Ranking, Long> {
}
