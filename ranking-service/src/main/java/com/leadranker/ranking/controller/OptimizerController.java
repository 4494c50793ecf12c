package com.leadranker.ranking.controller;

import com.leadranker.common.model.EvalLead;
import com.leadranker.common.model.OptimizationProgress;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.csv.EvalSetInfo;
import com.leadranker.ranking.csv.EvalSetParser;
import com.leadranker.ranking.csv.EvalSetSource;
import com.leadranker.ranking.dto.StartOptimizationRequest;
import com.leadranker.ranking.optimizer.GeneticPromptOptimizer;
import com.leadranker.ranking.optimizer.OptimizerSettings;
import com.leadranker.ranking.service.PromptService;
import com.leadranker.ranking.store.PromptVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/optimizer")
public class OptimizerController {

    private static final Logger log = LoggerFactory.getLogger(OptimizerController.class);

    private final GeneticPromptOptimizer optimizer;
    private final PromptService promptService;
    private final EvalSetSource evalSetSource;
    private final String defaultProvider;

    public OptimizerController(GeneticPromptOptimizer optimizer,
                               PromptService promptService,
                               EvalSetSource evalSetSource,
                               @Value("${ai.default-provider:openai}") String defaultProvider) {
        this.optimizer       = optimizer;
        this.promptService   = promptService;
        this.evalSetSource   = evalSetSource;
        this.defaultProvider = defaultProvider;
    }

    /** Canonical run against the shared evaluation set. */
    @PostMapping("/start")
    public Mono<ResponseEntity<Object>> start(@RequestBody(required = false) StartOptimizationRequest request) {
        return Mono.fromCallable(() -> {
                List<EvalLead> evalLeads = evalSetSource.get();
                if (evalLeads.isEmpty()) {
                    throw new IllegalArgumentException("No evaluation data available. Ensure the evaluation CSV exists.");
                }
                String runId = optimizer.startOptimization(evalLeads, provider(request), settings(request));
                return startedBody(runId, evalLeads.size());
            })
            .map(body -> ResponseEntity.ok((Object) body))
            .onErrorResume(e -> {
                log.warn("[OptimizerAPI] start rejected. reason={}", e.getMessage());
                return Mono.just(ApiErrors.toResponse(e));
            });
    }

    /** Session run against a caller-supplied evaluation CSV. */
    @PostMapping("/session")
    public Mono<ResponseEntity<Object>> startSession(@RequestBody StartOptimizationRequest request) {
        return Mono.fromCallable(() -> {
                List<EvalLead> evalLeads = EvalSetParser.parse(request.csv());
                if (evalLeads.isEmpty()) {
                    throw new IllegalArgumentException(
                        "No evaluation data found. Ensure the CSV matches the evaluation set format.");
                }
                String runId = optimizer.startSessionOptimization(evalLeads, provider(request),
                                                                  request.sessionId(), settings(request));
                return startedBody(runId, evalLeads.size());
            })
            .map(body -> ResponseEntity.ok((Object) body))
            .onErrorResume(e -> {
                log.warn("[OptimizerAPI] session start rejected. sessionId={} reason={}",
                         request.sessionId(), e.getMessage());
                return Mono.just(ApiErrors.toResponse(e));
            });
    }

    @GetMapping("/progress/{runId}")
    public ResponseEntity<OptimizationProgress> progress(@PathVariable String runId) {
        return ResponseEntity.ok(optimizer.getProgress(runId));
    }

    @GetMapping("/history")
    public Flux<PromptVersion> history() {
        return promptService.getOptimizationHistory();
    }

    @PostMapping("/activate/{version}")
    public Mono<ResponseEntity<Object>> activate(@PathVariable int version) {
        return promptService.activatePrompt(version)
            .map(p -> ResponseEntity.ok((Object) Map.of("success", true, "version", p.version())))
            .onErrorResume(e -> {
                log.warn("[OptimizerAPI] activate failed. version={} reason={}", version, e.getMessage());
                return Mono.just(ApiErrors.toResponse(e));
            });
    }

    @GetMapping("/eval-set")
    public ResponseEntity<EvalSetInfo> evalSet() {
        return ResponseEntity.ok(evalSetSource.info());
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private AiProvider provider(StartOptimizationRequest request) {
        String name = request != null && request.provider() != null ? request.provider() : defaultProvider;
        return AiProvider.fromWireName(name);
    }

    private static OptimizerSettings settings(StartOptimizationRequest request) {
        return request == null
            ? OptimizerSettings.defaults()
            : OptimizerSettings.of(request.populationSize(), request.generations(), request.sampleSize());
    }

    private static Map<String, Object> startedBody(String runId, int evalLeadsCount) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        body.put("evalLeadsCount", evalLeadsCount);
        return body;
    }
}
