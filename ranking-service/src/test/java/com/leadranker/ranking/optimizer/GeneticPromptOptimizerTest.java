package com.leadranker.ranking.optimizer;

import com.leadranker.common.model.EvalLead;
import com.leadranker.common.model.OptimizationProgress;
import com.leadranker.common.model.PromptCandidate;
import com.leadranker.common.model.RunStatus;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.ai.ProviderNotConfiguredException;
import com.leadranker.ranking.progress.ProgressStore;
import com.leadranker.ranking.service.PromptService;
import com.leadranker.ranking.session.SessionStateStore;
import com.leadranker.ranking.store.PromptVersion;
import com.leadranker.ranking.support.InMemoryAiCallLogStore;
import com.leadranker.ranking.support.InMemoryPromptStore;
import com.leadranker.ranking.support.ScriptedAiChatClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class GeneticPromptOptimizerTest {

    private static final String RUN = "opt_test";
    private static final String SEED = "SEED prompt";
    private static final String OPERATOR_PREFIX = "You are an expert at optimizing prompts";

    private static final List<EvalLead> EVAL_SET = List.of(
        new EvalLead("Ann Lee", "VP Sales", "Acme", "", "51-200", 1),
        new EvalLead("Bob Ray", "HR Manager", "Acme", "", "51-200", null));

    private static final OptimizerSettings SMALL = new OptimizerSettings(3, 1, 10, 0.7, 2, 3);

    private InMemoryPromptStore promptStore;
    private InMemoryAiCallLogStore callLog;
    private SessionStateStore sessions;
    private ProgressStore<OptimizationProgress> progress;

    @BeforeEach
    void setUp() {
        promptStore = new InMemoryPromptStore();
        callLog     = new InMemoryAiCallLogStore();
        sessions    = new SessionStateStore();
        progress    = new ProgressStore<>(OptimizationProgress::idle);
        promptStore.seedActive(1, SEED);
    }

    private GeneticPromptOptimizer optimizer(ScriptedAiChatClient ai) {
        return new GeneticPromptOptimizer(new PromptService(promptStore), promptStore,
            new PromptEvaluator(ai, callLog), new PromptMutator(ai, callLog),
            ai, sessions, progress, new Random(42));
    }

    /** Perfect answer for prompts starting with {@code goodPrefix}, an unparseable one otherwise. */
    private static Function<String, String> ranker(String goodPrefix, Function<String, String> operator) {
        return prompt -> {
            if (prompt.startsWith(OPERATOR_PREFIX)) return operator.apply(prompt);
            if (prompt.startsWith(goodPrefix)) {
                return ScriptedAiChatClient.rankByTitle(prompt, title -> title.equals("VP Sales") ? 1 : null);
            }
            return "no idea";
        };
    }

    /** Returns the first parent embedded in a mutation or crossover request. */
    private static String echoParent(String operatorPrompt) {
        int start = operatorPrompt.indexOf("---\n") + 4;
        int end = operatorPrompt.indexOf("\n---", start);
        return operatorPrompt.substring(start, end);
    }

    @Nested
    @DisplayName("runOptimization()")
    class Run {

        @Test
        @DisplayName("operators echo the parent → best after one generation scores at least the seed")
        void echoOperatorsNeverRegress() {
            ScriptedAiChatClient ai = new ScriptedAiChatClient(ranker("SEED", GeneticPromptOptimizerTest::echoParent));
            double seedFitness = new PromptEvaluator(ai, callLog).evaluate(SEED, EVAL_SET, AiProvider.OPENAI, RUN)
                .block().fitness();

            PromptCandidate best = optimizer(ai).runOptimization(EVAL_SET, AiProvider.OPENAI, RUN, SMALL, null).block();

            assertEquals(1.0, seedFitness, 1e-9);
            assertTrue(best.fitness() >= seedFitness);
            OptimizationProgress p = progress.get(RUN);
            assertEquals(RunStatus.COMPLETED, p.status());
            assertEquals(1, p.currentGeneration());
            assertEquals(best.fitness(), p.bestFitness(), 1e-9);
            assertTrue(p.evaluationsRun() >= 4);
        }

        @Test
        @DisplayName("worse mutants → seed survives and is saved as a new inactive version")
        void elitismKeepsSeed() {
            ScriptedAiChatClient ai = new ScriptedAiChatClient(ranker("SEED", prompt -> "MUTANT prompt"));

            PromptCandidate best = optimizer(ai).runOptimization(EVAL_SET, AiProvider.OPENAI, RUN, SMALL, null).block();

            assertEquals(SEED, best.content());
            assertEquals(1.0, best.fitness(), 1e-9);
            assertEquals(2, promptStore.rows.size());
            PromptVersion saved = promptStore.findByVersion(best.version()).block();
            assertNotNull(saved);
            assertTrue(best.version() > 1);
            assertFalse(saved.active());
            assertEquals(1.0, saved.evalScore(), 1e-9);
            assertEquals(1, promptStore.findActive().block().version());
        }

        @Test
        @DisplayName("better mutant wins and keeps its lineage")
        void betterMutantWins() {
            ScriptedAiChatClient ai = new ScriptedAiChatClient(ranker("BETTER", prompt -> "BETTER prompt"));

            PromptCandidate best = optimizer(ai).runOptimization(EVAL_SET, AiProvider.OPENAI, RUN, SMALL, null).block();

            assertEquals("BETTER prompt", best.content());
            assertEquals(1.0, best.fitness(), 1e-9);
            assertTrue(best.version() > 1);
            assertEquals(1, best.parentVersion());
            PromptVersion saved = promptStore.findByVersion(best.version()).block();
            assertEquals("BETTER prompt", saved.content());
            assertFalse(saved.active());
        }

        @Test
        @DisplayName("failing evaluation calls degrade to irrelevant predictions, the run still completes")
        void evaluationFailuresDegrade() {
            ScriptedAiChatClient ai = new ScriptedAiChatClient(prompt ->
                prompt.startsWith(OPERATOR_PREFIX) ? "MUTANT prompt" : null);

            PromptCandidate best = optimizer(ai).runOptimization(EVAL_SET, AiProvider.OPENAI, RUN, SMALL, null).block();

            assertEquals(0.5, best.fitness(), 1e-9);
            assertEquals(RunStatus.COMPLETED, progress.get(RUN).status());
        }

        @Test
        @DisplayName("failing operator call is fatal for the run")
        void operatorFailureIsFatal() {
            ScriptedAiChatClient ai = new ScriptedAiChatClient(ranker("SEED", prompt -> null));

            assertThrows(RuntimeException.class,
                () -> optimizer(ai).runOptimization(EVAL_SET, AiProvider.OPENAI, RUN, SMALL, null).block());

            assertEquals(RunStatus.ERROR, progress.get(RUN).status());
            assertNotNull(progress.get(RUN).error());
            assertEquals(1, promptStore.rows.size());
        }

        @Test
        @DisplayName("session run stashes the winner as override and persists nothing")
        void sessionVariant() {
            ScriptedAiChatClient ai = new ScriptedAiChatClient(ranker("BETTER", prompt -> "BETTER prompt"));

            optimizer(ai).runOptimization(EVAL_SET, AiProvider.OPENAI, RUN, SMALL, "s1").block();

            assertEquals("BETTER prompt", sessions.getOptimizedPrompt("s1"));
            assertTrue(sessions.hasPendingOptimization("s1"));
            assertEquals(1, promptStore.rows.size());
        }

        @Test
        @DisplayName("every LLM call of the run is logged under the run id")
        void callsLogged() {
            ScriptedAiChatClient ai = new ScriptedAiChatClient(ranker("SEED", GeneticPromptOptimizerTest::echoParent));

            optimizer(ai).runOptimization(EVAL_SET, AiProvider.OPENAI, RUN, SMALL, null).block();

            assertEquals(ai.calls.size(), callLog.records.size());
            assertTrue(callLog.records.stream().allMatch(r -> RUN.equals(r.batchId())));
        }
    }

    @Nested
    @DisplayName("start validation")
    class StartValidation {

        @Test
        @DisplayName("out-of-range settings are rejected")
        void badSettings() {
            GeneticPromptOptimizer optimizer = optimizer(new ScriptedAiChatClient(p -> "{}"));
            assertThrows(IllegalArgumentException.class, () -> optimizer.startOptimization(EVAL_SET,
                AiProvider.OPENAI, OptimizerSettings.of(2, null, null)));
            assertThrows(IllegalArgumentException.class, () -> optimizer.startOptimization(EVAL_SET,
                AiProvider.OPENAI, OptimizerSettings.of(null, 21, null)));
            assertThrows(IllegalArgumentException.class, () -> optimizer.startOptimization(EVAL_SET,
                AiProvider.OPENAI, OptimizerSettings.of(null, null, 5)));
        }

        @Test
        @DisplayName("empty evaluation set is rejected")
        void emptyEvalSet() {
            GeneticPromptOptimizer optimizer = optimizer(new ScriptedAiChatClient(p -> "{}"));
            assertThrows(IllegalArgumentException.class,
                () -> optimizer.startOptimization(List.of(), AiProvider.OPENAI, OptimizerSettings.defaults()));
        }

        @Test
        @DisplayName("unconfigured provider is rejected")
        void unconfiguredProvider() {
            GeneticPromptOptimizer optimizer = optimizer(
                new ScriptedAiChatClient(EnumSet.of(AiProvider.OPENAI), p -> "{}"));
            assertThrows(ProviderNotConfiguredException.class,
                () -> optimizer.startOptimization(EVAL_SET, AiProvider.OPENROUTER, OptimizerSettings.defaults()));
        }

        @Test
        @DisplayName("session run requires a session id")
        void sessionIdRequired() {
            GeneticPromptOptimizer optimizer = optimizer(new ScriptedAiChatClient(p -> "{}"));
            assertThrows(IllegalArgumentException.class, () -> optimizer.startSessionOptimization(
                EVAL_SET, AiProvider.OPENAI, " ", OptimizerSettings.defaults()));
        }
    }

    @Nested
    @DisplayName("selection helpers")
    class Selection {

        @Test
        @DisplayName("sample draws without replacement when the pool is larger")
        void sampleWithoutReplacement() {
            List<EvalLead> pool = IntStream.range(0, 50)
                .mapToObj(i -> new EvalLead("Lead " + i, "VP Sales", "Co " + i, "", "11-50", 1))
                .toList();

            List<EvalLead> sample = GeneticPromptOptimizer.sample(pool, 30, new Random(7));

            assertEquals(30, sample.size());
            Set<EvalLead> distinct = new HashSet<>(sample);
            assertEquals(30, distinct.size());
            assertTrue(pool.containsAll(sample));
        }

        @Test
        @DisplayName("sample returns the whole pool when it is small enough")
        void smallPool() {
            assertEquals(EVAL_SET, GeneticPromptOptimizer.sample(EVAL_SET, 30, new Random(7)));
        }

        @Test
        @DisplayName("tournament returns the fittest contender drawn")
        void tournament() {
            List<PromptCandidate> population = List.of(
                new PromptCandidate("a", 1, 0.2, 0, null),
                new PromptCandidate("b", 2, 0.9, 0, null),
                new PromptCandidate("c", 3, 0.5, 0, null));

            PromptCandidate single = GeneticPromptOptimizer.tournamentSelect(List.of(population.get(2)), 3, new Random(1));
            assertEquals("c", single.content());

            Random random = new Random(3);
            for (int i = 0; i < 20; i++) {
                PromptCandidate winner = GeneticPromptOptimizer.tournamentSelect(population, 50, random);
                assertEquals("b", winner.content());
            }
        }

        @Test
        @DisplayName("sorting is stable, so earlier candidates win ties")
        void stableSort() {
            List<PromptCandidate> sorted = GeneticPromptOptimizer.sorted(List.of(
                new PromptCandidate("seed", 1, 0.8, 0, null),
                new PromptCandidate("x", 2, 0.9, 0, 1),
                new PromptCandidate("y", 3, 0.8, 0, 1)));

            assertEquals(List.of("x", "seed", "y"), sorted.stream().map(PromptCandidate::content).toList());
        }
    }
}
