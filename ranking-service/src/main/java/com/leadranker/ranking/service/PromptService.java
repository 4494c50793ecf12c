package com.leadranker.ranking.service;

import com.leadranker.ranking.store.PromptStore;
import com.leadranker.ranking.store.PromptVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Owns the canonical ranking prompt and its version history.
 */
@Service
public class PromptService {

    private static final Logger log = LoggerFactory.getLogger(PromptService.class);

    public static final String DEFAULT_PROMPT = DefaultPrompt.CONTENT;

    private final PromptStore promptStore;

    public PromptService(PromptStore promptStore) {
        this.promptStore = promptStore;
    }

    /**
     * Returns the active prompt. When no prompt is active the default prompt
     * is inserted as active at the next free version; later calls return that
     * row. Concurrent first calls are not serialized: the version column is
     * unique, so the losing insert fails and is re-read.
     */
    public Mono<PromptVersion> getActivePromptWithVersion() {
        return promptStore.findActive()
            .switchIfEmpty(Mono.defer(this::createDefaultPrompt));
    }

    /** The override text, when present, replaces the content but keeps the canonical version. */
    public static PromptVersion selectPromptForRanking(PromptVersion active, String sessionOverride) {
        if (sessionOverride == null || sessionOverride.isBlank()) {
            return active;
        }
        return new PromptVersion(active.version(), sessionOverride, active.evalScore(), active.active(),
            active.generation(), active.parentVersion(), active.createdAt());
    }

    /**
     * @return the activated prompt
     * @throws IllegalArgumentException (as an error signal) for unknown versions
     */
    public Mono<PromptVersion> activatePrompt(int version) {
        return promptStore.activate(version)
            .flatMap(activated -> activated
                ? promptStore.findByVersion(version)
                : Mono.error(new IllegalArgumentException("Prompt version " + version + " not found")))
            .doOnSuccess(p -> log.info("[Prompts] Prompt activated. version={}", version));
    }

    public Flux<PromptVersion> getOptimizationHistory() {
        return promptStore.findAllByVersionDesc();
    }

    public Mono<Integer> nextFreeVersion() {
        return promptStore.findMaxVersion().map(max -> max + 1);
    }

    private Mono<PromptVersion> createDefaultPrompt() {
        return nextFreeVersion()
            .flatMap(version -> promptStore.insert(
                PromptVersion.draft(version, DEFAULT_PROMPT, null, true, 0, null)))
            .doOnSuccess(p -> log.info("[Prompts] No active prompt. Default prompt created. version={}", p.version()))
            .onErrorResume(e -> promptStore.findActive()
                .switchIfEmpty(Mono.error(e)));
    }
}
