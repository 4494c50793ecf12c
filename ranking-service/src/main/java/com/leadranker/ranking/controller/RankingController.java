package com.leadranker.ranking.controller;

import com.leadranker.common.model.RankingProgress;
import com.leadranker.ranking.ai.AiChatClient;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.dto.StartRankingRequest;
import com.leadranker.ranking.service.RankingOrchestrator;
import com.leadranker.ranking.session.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Ranking batches. A start returns the batch id at once; clients poll
 * {@code /progress/{batchId}} until the status is completed or error.
 */
@RestController
@RequestMapping("/api/v1/ranking")
public class RankingController {

    private static final Logger log = LoggerFactory.getLogger(RankingController.class);

    private final RankingOrchestrator orchestrator;
    private final AiChatClient aiChatClient;
    private final SessionStateStore sessionStore;
    private final String defaultProvider;

    public RankingController(RankingOrchestrator orchestrator,
                             AiChatClient aiChatClient,
                             SessionStateStore sessionStore,
                             @Value("${ai.default-provider:openai}") String defaultProvider) {
        this.orchestrator    = orchestrator;
        this.aiChatClient    = aiChatClient;
        this.sessionStore    = sessionStore;
        this.defaultProvider = defaultProvider;
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<Object>> start(@RequestBody(required = false) StartRankingRequest request) {
        String provider  = request != null && request.provider() != null ? request.provider() : defaultProvider;
        String sessionId = request != null ? request.sessionId() : null;
        log.info("[RankingAPI] start. provider={} sessionId={}", provider, sessionId);

        return Mono.fromCallable(() -> orchestrator.startRanking(AiProvider.fromWireName(provider), sessionId))
            .map(batchId -> ResponseEntity.ok((Object) Map.of("batchId", batchId)))
            .onErrorResume(e -> {
                log.warn("[RankingAPI] start rejected. provider={} reason={}", provider, e.getMessage());
                return Mono.just(ApiErrors.toResponse(e));
            });
    }

    @GetMapping("/progress/{batchId}")
    public ResponseEntity<RankingProgress> progress(@PathVariable String batchId) {
        return ResponseEntity.ok(orchestrator.getProgress(batchId));
    }

    /** Configured providers and the default one. */
    @GetMapping("/providers")
    public ResponseEntity<Map<String, Object>> providers() {
        return ResponseEntity.ok(Map.<String, Object>of(
            "available", aiChatClient.availableProviders(),
            "default",   defaultProvider
        ));
    }

    /** Rank deltas recorded by the session's first ranking run after an optimization. */
    @GetMapping("/changes")
    public ResponseEntity<Map<String, Object>> changes(@RequestParam String sessionId) {
        return ResponseEntity.ok(Map.<String, Object>of(
            "changes",             sessionStore.getRankingChanges(sessionId),
            "pendingOptimization", sessionStore.hasPendingOptimization(sessionId)
        ));
    }
}
