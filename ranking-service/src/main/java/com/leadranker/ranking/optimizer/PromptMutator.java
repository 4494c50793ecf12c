package com.leadranker.ranking.optimizer;

import com.leadranker.ranking.ai.AiChatClient;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.ai.ChatMessage;
import com.leadranker.ranking.ai.ChatOptions;
import com.leadranker.ranking.store.AiCallLogStore;
import com.leadranker.ranking.store.AiCallRecord;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/** LLM-backed genetic operators: mutation guided by error hints, and crossover. */
@Component
public class PromptMutator {

    static final double MUTATION_TEMPERATURE  = 0.7;
    static final double CROSSOVER_TEMPERATURE = 0.5;
    static final int    OPERATOR_MAX_TOKENS   = 4000;

    static final String EXPLORE_HINT =
        "- Initial evaluation: creating diverse variations to explore the solution space.";

    private static final String MUTATION_TEMPLATE = """
        You are an expert at optimizing prompts for AI lead qualification systems.

        Current prompt:
        ---
        %s
        ---

        Evaluation found these issues:
        %s

        Write an improved version of this prompt that:
        1. Fixes the issues listed above
        2. Keeps the core ranking criteria
        3. Is clear and specific about how leads are ranked
        4. Handles edge cases better

        Return ONLY the improved prompt text, nothing else.""";

    private static final String CROSSOVER_TEMPLATE = """
        You are an expert at optimizing prompts for AI lead qualification systems.

        Two prompts performed well:

        PROMPT A:
        ---
        %s
        ---

        PROMPT B:
        ---
        %s
        ---

        Write one new prompt combining the strongest parts of both. It should:
        1. Keep the clearest instructions from each
        2. Merge their ranking criteria
        3. Read as one coherent, well-structured prompt

        Return ONLY the new combined prompt text, nothing else.""";

    private final AiChatClient aiChatClient;
    private final AiCallLogStore aiCallLogStore;

    public PromptMutator(AiChatClient aiChatClient, AiCallLogStore aiCallLogStore) {
        this.aiChatClient   = aiChatClient;
        this.aiCallLogStore = aiCallLogStore;
    }

    /** @param hints improvement hints, one per line; the explore hint when empty */
    public Mono<String> mutate(String parent, List<String> hints, AiProvider provider, String runId) {
        String issues = hints == null || hints.isEmpty() ? EXPLORE_HINT : String.join("\n", hints);
        return call(String.format(MUTATION_TEMPLATE, parent, issues), MUTATION_TEMPERATURE, provider, runId);
    }

    public Mono<String> crossover(String parentA, String parentB, AiProvider provider, String runId) {
        return call(String.format(CROSSOVER_TEMPLATE, parentA, parentB), CROSSOVER_TEMPERATURE, provider, runId);
    }

    private Mono<String> call(String request, double temperature, AiProvider provider, String runId) {
        return aiChatClient.chat(provider, List.of(ChatMessage.user(request)),
                                 ChatOptions.text(temperature, OPERATOR_MAX_TOKENS))
            .flatMap(completion -> aiCallLogStore.append(AiCallRecord.of(completion, runId, null))
                .thenReturn(completion.content().trim()));
    }
}
