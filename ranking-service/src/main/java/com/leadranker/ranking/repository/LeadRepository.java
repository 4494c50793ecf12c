package com.leadranker.ranking.repository;

import com.leadranker.ranking.model.Lead;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface LeadRepository extends ReactiveCrudRepository<Lead, Long> {

    Flux<Lead> findAllByOrderByIdAsc();
}
