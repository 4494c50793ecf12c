package com.leadranker.ranking.optimizer;

import com.leadranker.common.model.EvalLead;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.ai.ChatOptions;
import com.leadranker.ranking.support.InMemoryAiCallLogStore;
import com.leadranker.ranking.support.ScriptedAiChatClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PromptEvaluatorTest {

    @Test
    @DisplayName("one JSON call per company at temperature 0.1 with the lead-group token budget")
    void callShape() {
        List<EvalLead> sample = IntStream.range(0, 20)
            .mapToObj(i -> new EvalLead("Lead " + i, "VP Sales", i < 18 ? "Acme" : "Globex", "", "51-200", 1))
            .toList();
        ScriptedAiChatClient ai = new ScriptedAiChatClient(
            prompt -> ScriptedAiChatClient.rankByTitle(prompt, title -> 1));
        InMemoryAiCallLogStore callLog = new InMemoryAiCallLogStore();

        PromptEvaluation evaluation = new PromptEvaluator(ai, callLog)
            .evaluate("Rank sales leaders first.", sample, AiProvider.OPENAI, "opt_eval").block();

        assertEquals(1.0, evaluation.fitness(), 1e-9);
        assertEquals(2, ai.calls.size());
        ChatOptions acme = ai.calls.get(0).options();
        assertTrue(acme.jsonMode());
        assertEquals(0.1, acme.temperature(), 1e-9);
        assertEquals(ChatOptions.maxTokensForLeads(18), acme.maxTokens());
        assertEquals(ChatOptions.maxTokensForLeads(2), ai.calls.get(1).options().maxTokens());
        assertEquals(2, callLog.records.size());
    }
}
