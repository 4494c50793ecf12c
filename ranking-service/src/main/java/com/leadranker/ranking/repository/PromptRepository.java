package com.leadranker.ranking.repository;

import com.leadranker.ranking.model.Prompt;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface PromptRepository extends ReactiveCrudRepository<Prompt, Long> {

    Mono<Prompt> findFirstByActiveTrueOrderByVersionDesc();

    Mono<Prompt> findByVersion(Integer version);

    Flux<Prompt> findAllByOrderByVersionDesc();

    @Query("SELECT COALESCE(MAX(version), 0) FROM prompts")
    Mono<Integer> findMaxVersion();

    @Modifying
    @Query("UPDATE prompts SET is_active = false WHERE is_active = true")
    Mono<Integer> deactivateAll();

    @Modifying
    @Query("UPDATE prompts SET is_active = true WHERE version = :version")
    Mono<Integer> activateVersion(int version);
}
