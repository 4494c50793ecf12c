package com.leadranker.ranking.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface PromptStore {

    /** The active prompt with the highest version, or empty. */
    Mono<PromptVersion> findActive();

    Mono<PromptVersion> findByVersion(int version);

    /** Highest stored version; 0 for an empty table. */
    Mono<Integer> findMaxVersion();

    Mono<PromptVersion> insert(PromptVersion prompt);

    /**
     * Makes {@code version} the only active prompt.
     *
     * @return false when no prompt has that version; nothing changes then
     */
    Mono<Boolean> activate(int version);

    Flux<PromptVersion> findAllByVersionDesc();
}
