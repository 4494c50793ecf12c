package com.leadranker.ranking.repository;

import com.leadranker.ranking.model.AiCallLog;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AiCallLogRepository extends ReactiveCrudRepository<AiCallLog, Long> {
}
