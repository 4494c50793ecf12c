package com.leadranker.ranking.optimizer;

import com.leadranker.common.fitness.Prediction;
import com.leadranker.common.model.EvalLead;
import com.leadranker.common.model.LeadForRanking;
import com.leadranker.common.ranking.RankingPromptBuilder;
import com.leadranker.common.ranking.RankingResponseParser;
import com.leadranker.ranking.ai.AiChatClient;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.ai.ChatMessage;
import com.leadranker.ranking.ai.ChatOptions;
import com.leadranker.ranking.store.AiCallLogStore;
import com.leadranker.ranking.store.AiCallRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a candidate prompt against labelled evaluation leads by ranking
 * them exactly as a production batch would: one call per company, same
 * request builder, same response parser.
 *
 * <p>A failed company call does not fail the evaluation; its leads are
 * scored as predicted irrelevant.
 */
@Component
public class PromptEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PromptEvaluator.class);

    static final double EVALUATION_TEMPERATURE = 0.1;
    static final String EVAL_ID_PREFIX = "eval-";

    private final AiChatClient aiChatClient;
    private final AiCallLogStore aiCallLogStore;

    public PromptEvaluator(AiChatClient aiChatClient, AiCallLogStore aiCallLogStore) {
        this.aiChatClient   = aiChatClient;
        this.aiCallLogStore = aiCallLogStore;
    }

    public Mono<PromptEvaluation> evaluate(String promptContent, List<EvalLead> sample,
                                           AiProvider provider, String runId) {
        Map<String, Integer> expected = new HashMap<>();
        Map<String, List<LeadForRanking>> companies = new LinkedHashMap<>();
        for (int i = 0; i < sample.size(); i++) {
            EvalLead evalLead = sample.get(i);
            LeadForRanking lead = toLead(EVAL_ID_PREFIX + i, evalLead);
            expected.put(lead.id(), evalLead.expectedRank());
            companies.computeIfAbsent(lead.companyName(), c -> new ArrayList<>()).add(lead);
        }

        return Flux.fromIterable(companies.entrySet())
            .concatMap(company -> evaluateCompany(promptContent, company.getKey(), company.getValue(),
                                                  expected, provider, runId))
            .flatMapIterable(predictions -> predictions)
            .collectList()
            .map(PromptEvaluation::of);
    }

    private Mono<List<Prediction>> evaluateCompany(String promptContent, String companyName,
                                                   List<LeadForRanking> leads, Map<String, Integer> expected,
                                                   AiProvider provider, String runId) {
        List<String> leadIds = leads.stream().map(LeadForRanking::id).toList();
        ChatOptions options = ChatOptions.json(EVALUATION_TEMPERATURE, ChatOptions.maxTokensForLeads(leads.size()));

        return Mono.fromCallable(() -> RankingPromptBuilder.build(promptContent, leads))
            .flatMap(text -> aiChatClient.chat(provider, List.of(ChatMessage.user(text)), options))
            .flatMap(completion -> aiCallLogStore.append(AiCallRecord.of(completion, runId, null))
                .thenReturn(completion))
            .map(completion -> RankingResponseParser.parse(completion.content(), leadIds))
            .map(results -> results.stream()
                .map(r -> new Prediction(r.rank(), expected.get(r.leadId())))
                .toList())
            .onErrorResume(e -> {
                log.warn("[PromptEval] Company evaluation failed, scoring as irrelevant. runId={} company={} reason={}",
                         runId, companyName, e.getMessage());
                return Mono.just(leadIds.stream()
                    .map(id -> new Prediction(null, expected.get(id)))
                    .toList());
            });
    }

    static LeadForRanking toLead(String id, EvalLead evalLead) {
        return new LeadForRanking(id, evalLead.fullName(), "", evalLead.title(), evalLead.company(),
                                  evalLead.employeeRange(), null);
    }
}
