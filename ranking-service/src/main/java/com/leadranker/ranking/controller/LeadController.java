package com.leadranker.ranking.controller;

import com.leadranker.ranking.dto.ImportLeadsRequest;
import com.leadranker.ranking.dto.LeadListQuery;
import com.leadranker.ranking.dto.RankingStats;
import com.leadranker.ranking.service.LeadImportService;
import com.leadranker.ranking.service.LeadQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/leads")
public class LeadController {

    private static final Logger log = LoggerFactory.getLogger(LeadController.class);

    private final LeadQueryService queryService;
    private final LeadImportService importService;

    public LeadController(LeadQueryService queryService, LeadImportService importService) {
        this.queryService  = queryService;
        this.importService = importService;
    }

    @GetMapping
    public Mono<ResponseEntity<Object>> list(@RequestParam(required = false) Integer page,
                                             @RequestParam(required = false) Integer pageSize,
                                             @RequestParam(required = false) String sortBy,
                                             @RequestParam(required = false) String sortOrder,
                                             @RequestParam(required = false) Boolean showIrrelevant) {
        return Mono.fromCallable(() -> LeadListQuery.of(page, pageSize, sortBy, sortOrder, showIrrelevant))
            .flatMap(queryService::listLeads)
            .map(leads -> ResponseEntity.ok((Object) leads))
            .onErrorResume(e -> Mono.just(ApiErrors.toResponse(e)));
    }

    @GetMapping("/stats")
    public Mono<RankingStats> stats(@RequestParam(required = false) String sessionId) {
        return queryService.getRankingStats(sessionId);
    }

    /** Replaces every lead with the rows of the posted CSV. */
    @PostMapping("/import")
    public Mono<ResponseEntity<Object>> importCsv(@RequestBody ImportLeadsRequest request) {
        return importService.importCsv(request.csv())
            .map(n -> ResponseEntity.ok((Object) Map.of("imported", n)))
            .onErrorResume(e -> {
                log.warn("[LeadsAPI] import rejected. reason={}", e.getMessage());
                return Mono.just(ApiErrors.toResponse(e));
            });
    }

    @DeleteMapping
    public Mono<ResponseEntity<Object>> clearAll() {
        return importService.clearAll()
            .then(Mono.just(ResponseEntity.ok((Object) Map.of("success", true))))
            .onErrorResume(e -> {
                log.error("[LeadsAPI] clear failed.", e);
                return Mono.just(ApiErrors.toResponse(e));
            });
    }
}
