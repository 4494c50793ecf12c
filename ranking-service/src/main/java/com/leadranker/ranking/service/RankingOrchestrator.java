package com.leadranker.ranking.service;

import com.leadranker.common.exception.RunFailedException;
import com.leadranker.common.model.LeadForRanking;
import com.leadranker.common.model.RankingChange;
import com.leadranker.common.model.RankingProgress;
import com.leadranker.common.model.RankingResult;
import com.leadranker.common.ranking.RankingPromptBuilder;
import com.leadranker.common.ranking.RankingResponseParser;
import com.leadranker.common.trace.RunContextUtil;
import com.leadranker.ranking.ai.AiChatClient;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.ai.ChatMessage;
import com.leadranker.ranking.ai.ChatOptions;
import com.leadranker.ranking.progress.ProgressStore;
import com.leadranker.ranking.progress.RunIds;
import com.leadranker.ranking.session.SessionStateStore;
import com.leadranker.ranking.store.AiCallLogStore;
import com.leadranker.ranking.store.AiCallRecord;
import com.leadranker.ranking.store.LeadRankingStore;
import com.leadranker.ranking.store.PromptVersion;
import com.leadranker.ranking.store.RankingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs a ranking batch over every stored lead, one LLM call per company.
 *
 * <p>A batch moves idle → running → completed | error. Companies are processed
 * strictly one after another; a failed company is logged and skipped, its
 * leads still count towards {@code completed}. Anything failing outside a
 * company call marks the batch as error.
 *
 * <p>When the session carries a freshly optimized prompt, the ranks before the
 * run are captured and the deltas are stored on the session afterwards.
 */
@Service
public class RankingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RankingOrchestrator.class);

    static final double RANKING_TEMPERATURE = 0.2;

    private final LeadRankingStore leadRankingStore;
    private final AiCallLogStore aiCallLogStore;
    private final PromptService promptService;
    private final AiChatClient aiChatClient;
    private final SessionStateStore sessionStore;
    private final ProgressStore<RankingProgress> progressStore;

    public RankingOrchestrator(LeadRankingStore leadRankingStore,
                               AiCallLogStore aiCallLogStore,
                               PromptService promptService,
                               AiChatClient aiChatClient,
                               SessionStateStore sessionStore,
                               ProgressStore<RankingProgress> rankingProgressStore) {
        this.leadRankingStore = leadRankingStore;
        this.aiCallLogStore   = aiCallLogStore;
        this.promptService    = promptService;
        this.aiChatClient     = aiChatClient;
        this.sessionStore     = sessionStore;
        this.progressStore    = rankingProgressStore;
    }

    /**
     * Starts a batch in the background and returns its id immediately.
     *
     * @throws com.leadranker.ranking.ai.ProviderNotConfiguredException when the provider has no key
     */
    public String startRanking(AiProvider provider, String sessionId) {
        aiChatClient.requireConfigured(provider);

        String batchId = RunIds.newBatchId();
        sessionStore.registerBatchId(sessionId, batchId);
        progressStore.update(batchId, p -> p.started(0));

        runRanking(provider, batchId, sessionId)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                v -> {},
                e -> log.error("[RankingRun] Batch failed. batchId={} reason={}", batchId, e.getMessage(), e)
            );

        log.info("[RankingRun] Batch started. batchId={} provider={} sessionId={}",
                 batchId, provider.wireName(), sessionId);
        return batchId;
    }

    public RankingProgress getProgress(String batchId) {
        return progressStore.get(batchId);
    }

    /** The whole batch as one pipeline; completes once progress is terminal. */
    public Mono<Void> runRanking(AiProvider provider, String batchId, String sessionId) {
        boolean captureChanges = sessionStore.hasPendingOptimization(sessionId);

        Mono<Void> pipeline = leadRankingStore.findAllLeads().collectList()
            .flatMap(leads -> {
                if (leads.isEmpty()) {
                    return Mono.error(new RunFailedException(batchId, "No leads to rank. Import leads first."));
                }
                progressStore.update(batchId, p -> p.started(leads.size()));
                Map<String, List<LeadForRanking>> companies = groupByCompany(leads);

                return promptService.getActivePromptWithVersion()
                    .switchIfEmpty(Mono.error(new RunFailedException(batchId, "No active prompt available")))
                    .map(active -> PromptService.selectPromptForRanking(active, sessionStore.getOptimizedPrompt(sessionId)))
                    .flatMap(prompt -> captureRanks(captureChanges)
                        .flatMap(oldRanks -> leadRankingStore.deleteAllRankings()
                            .thenMany(Flux.fromIterable(companies.entrySet())
                                .concatMap(company -> rankCompany(company.getKey(), company.getValue(),
                                                                  prompt, provider, batchId)))
                            .collectList()
                            .doOnNext(perCompany -> {
                                List<RankingResult> results = perCompany.stream()
                                    .flatMap(List::stream)
                                    .toList();
                                progressStore.update(batchId, RankingProgress::complete);
                                if (captureChanges) {
                                    List<RankingChange> changes = buildRankingChanges(oldRanks, leads, results);
                                    sessionStore.setRankingChanges(sessionId, changes);
                                    log.info("[RankingRun] Ranking changes recorded. batchId={} sessionId={} changes={}",
                                             batchId, sessionId, changes.size());
                                }
                                log.info("[RankingRun] Batch completed. batchId={} companies={} leads={} promptVersion={}",
                                         batchId, companies.size(), leads.size(), prompt.version());
                            })));
            })
            .doOnError(e -> progressStore.update(batchId, p -> p.failed(e.getMessage())))
            .then();
        return RunContextUtil.withRunId(pipeline, batchId);
    }

    /**
     * Ranks one company. Never errors: a failed call is logged and yields no
     * results, so its leads keep no ranking row for this batch.
     */
    Mono<List<RankingResult>> rankCompany(String companyName, List<LeadForRanking> companyLeads,
                                          PromptVersion prompt, AiProvider provider, String batchId) {
        List<String> leadIds = companyLeads.stream().map(LeadForRanking::id).toList();
        ChatOptions options = ChatOptions.json(RANKING_TEMPERATURE, ChatOptions.maxTokensForLeads(companyLeads.size()));

        return Mono.fromCallable(() -> {
                progressStore.update(batchId, p -> p.onCompany(companyName));
                return RankingPromptBuilder.build(prompt.content(), companyLeads);
            })
            .flatMap(text -> aiChatClient.chat(provider, List.of(ChatMessage.user(text)), options))
            .flatMap(completion -> aiCallLogStore.append(AiCallRecord.of(completion, batchId, prompt.version()))
                .thenReturn(completion))
            .map(completion -> RankingResponseParser.parse(completion.content(), leadIds))
            .flatMap(results -> leadRankingStore.saveRankings(
                    results.stream().map(r -> RankingRecord.of(r, prompt.version())).toList())
                .thenReturn(results))
            .doOnEach(RunContextUtil.logOnNext((runId, results) ->
                log.info("[RankingRun] Company ranked. batchId={} company={} leads={} relevant={}",
                         runId, companyName, results.size(),
                         results.stream().filter(RankingResult::isRelevant).count())))
            .onErrorResume(e -> {
                log.error("[RankingRun] Company failed, continuing. batchId={} company={} reason={}",
                          batchId, companyName, e.getMessage(), e);
                return Mono.just(List.<RankingResult>of());
            })
            .doOnSuccess(results -> progressStore.update(batchId, p -> p.advancedBy(companyLeads.size())));
    }

    static Map<String, List<LeadForRanking>> groupByCompany(List<LeadForRanking> leads) {
        return leads.stream().collect(Collectors.groupingBy(
            LeadForRanking::companyName, LinkedHashMap::new, Collectors.toList()));
    }

    private Mono<Map<String, Integer>> captureRanks(boolean captureChanges) {
        if (!captureChanges) {
            return Mono.just(Map.of());
        }
        // HashMap: irrelevant leads map to a null rank
        return leadRankingStore.findCurrentRanks()
            .collect(HashMap::new, (ranks, r) -> ranks.put(r.leadId(), r.rank()));
    }

    /**
     * Pairs every new result with the lead's previous rank and keeps the pairs
     * that differ. A lead without a previous row counts as previously null.
     */
    public static List<RankingChange> buildRankingChanges(Map<String, Integer> oldRanks,
                                                          List<LeadForRanking> leads,
                                                          List<RankingResult> results) {
        Map<String, LeadForRanking> byId = leads.stream()
            .collect(Collectors.toMap(LeadForRanking::id, Function.identity(), (a, b) -> a));

        List<RankingChange> changes = new ArrayList<>();
        for (RankingResult result : results) {
            Integer oldRank = oldRanks.get(result.leadId());
            if (Objects.equals(oldRank, result.rank())) continue;

            LeadForRanking lead = byId.get(result.leadId());
            changes.add(new RankingChange(
                result.leadId(),
                lead != null ? lead.fullName() : "",
                lead != null ? lead.companyName() : "",
                oldRank,
                result.rank()));
        }
        return changes;
    }
}
