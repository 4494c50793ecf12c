package com.leadranker.ranking.optimizer;

import com.leadranker.common.exception.RunFailedException;
import com.leadranker.common.model.EvalLead;
import com.leadranker.common.model.OptimizationProgress;
import com.leadranker.common.model.PromptCandidate;
import com.leadranker.common.trace.RunContextUtil;
import com.leadranker.ranking.ai.AiChatClient;
import com.leadranker.ranking.ai.AiProvider;
import com.leadranker.ranking.progress.ProgressStore;
import com.leadranker.ranking.progress.RunIds;
import com.leadranker.ranking.service.PromptService;
import com.leadranker.ranking.session.SessionStateStore;
import com.leadranker.ranking.store.PromptStore;
import com.leadranker.ranking.store.PromptVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evolves the ranking prompt with an LLM-driven genetic algorithm.
 *
 * <p>Generation 0 is the active prompt plus {@code populationSize - 1}
 * exploratory mutations of it. Every following generation keeps the elites
 * and breeds the rest by tournament selection, then either a hint-guided
 * mutation or a crossover. The best candidate ever seen survives to the end,
 * so the result never scores below the seed on the run's sample.
 *
 * <p>A canonical run persists the winner as a new inactive prompt version. A
 * session run leaves the prompts table alone and installs the winner as the
 * session's prompt override instead.
 */
@Service
public class GeneticPromptOptimizer {

    private static final Logger log = LoggerFactory.getLogger(GeneticPromptOptimizer.class);

    /** Sample items used for the quick evaluation that feeds a mutation. */
    static final int QUICK_EVAL_SIZE = 10;

    private static final Comparator<PromptCandidate> BY_FITNESS_DESC =
        Comparator.comparingDouble(PromptCandidate::fitness).reversed();

    private final PromptService promptService;
    private final PromptStore promptStore;
    private final PromptEvaluator evaluator;
    private final PromptMutator mutator;
    private final AiChatClient aiChatClient;
    private final SessionStateStore sessionStore;
    private final ProgressStore<OptimizationProgress> progressStore;
    private final Random random;

    public GeneticPromptOptimizer(PromptService promptService,
                                  PromptStore promptStore,
                                  PromptEvaluator evaluator,
                                  PromptMutator mutator,
                                  AiChatClient aiChatClient,
                                  SessionStateStore sessionStore,
                                  ProgressStore<OptimizationProgress> optimizationProgressStore,
                                  Random optimizerRandom) {
        this.promptService = promptService;
        this.promptStore   = promptStore;
        this.evaluator     = evaluator;
        this.mutator       = mutator;
        this.aiChatClient  = aiChatClient;
        this.sessionStore  = sessionStore;
        this.progressStore = optimizationProgressStore;
        this.random        = optimizerRandom;
    }

    /** Mutable state of one run; touched only by that run's sequential pipeline. */
    private static final class Evolution {
        final String runId;
        final AiProvider provider;
        final OptimizerSettings settings;
        final List<EvalLead> sample;
        final AtomicInteger nextVersion;
        final AtomicInteger evaluations = new AtomicInteger();
        List<PromptCandidate> population = List.of();
        PromptCandidate best;

        Evolution(String runId, AiProvider provider, OptimizerSettings settings,
                  List<EvalLead> sample, int firstFreeVersion) {
            this.runId       = runId;
            this.provider    = provider;
            this.settings    = settings;
            this.sample      = sample;
            this.nextVersion = new AtomicInteger(firstFreeVersion);
        }
    }

    // ── entry points ──────────────────────────────────────────────────────────

    /**
     * Starts a canonical run in the background.
     *
     * @throws IllegalArgumentException for out-of-range settings or an empty evaluation set
     * @throws com.leadranker.ranking.ai.ProviderNotConfiguredException when the provider has no key
     */
    public String startOptimization(List<EvalLead> evalLeads, AiProvider provider, OptimizerSettings settings) {
        return start(evalLeads, provider, settings, null);
    }

    /** Starts a run whose winner becomes {@code sessionId}'s prompt override. */
    public String startSessionOptimization(List<EvalLead> evalLeads, AiProvider provider,
                                           String sessionId, OptimizerSettings settings) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return start(evalLeads, provider, settings, sessionId);
    }

    public OptimizationProgress getProgress(String runId) {
        return progressStore.get(runId);
    }

    private String start(List<EvalLead> evalLeads, AiProvider provider, OptimizerSettings settings,
                         String sessionId) {
        settings.validate();
        if (evalLeads == null || evalLeads.isEmpty()) {
            throw new IllegalArgumentException("Evaluation set is empty");
        }
        aiChatClient.requireConfigured(provider);

        String runId = RunIds.newOptimizationRunId();
        sessionStore.registerBatchId(sessionId, runId);
        progressStore.update(runId, p -> p.started(settings.generations(), settings.populationSize()));

        runOptimization(evalLeads, provider, runId, settings, sessionId)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                best -> {},
                e -> log.error("[PromptOptimizer] Run failed. runId={} reason={}", runId, e.getMessage(), e)
            );

        log.info("[PromptOptimizer] Run started. runId={} provider={} sessionId={} population={} generations={} sampleSize={}",
                 runId, provider.wireName(), sessionId, settings.populationSize(), settings.generations(),
                 settings.sampleSize());
        return runId;
    }

    /**
     * The whole run as one pipeline.
     *
     * @param sessionId null for a canonical run
     * @return the best candidate, as persisted for canonical runs
     */
    public Mono<PromptCandidate> runOptimization(List<EvalLead> evalLeads, AiProvider provider, String runId,
                                                 OptimizerSettings settings, String sessionId) {
        Mono<PromptCandidate> pipeline = Mono.defer(() -> {
                progressStore.update(runId, p -> p.started(settings.generations(), settings.populationSize()));
                List<EvalLead> sample = sample(evalLeads, settings.sampleSize(), random);
                if (sample.isEmpty()) {
                    return Mono.error(new RunFailedException(runId, "Evaluation set has no usable rows"));
                }
                return Mono.zip(promptService.getActivePromptWithVersion(), promptStore.findMaxVersion())
                    .flatMap(seedAndMax -> {
                        PromptVersion seed = seedAndMax.getT1();
                        int firstFree = Math.max(seed.version(), seedAndMax.getT2()) + 1;
                        Evolution run = new Evolution(runId, provider, settings, sample, firstFree);
                        return evolve(run, seed);
                    });
            })
            .flatMap(best -> sessionId == null
                ? persistBest(best, runId)
                : Mono.fromCallable(() -> {
                    sessionStore.setOptimizedPrompt(sessionId, best.content());
                    log.info("[PromptOptimizer] Session override installed. runId={} sessionId={} fitness={}",
                             runId, sessionId, best.fitness());
                    return best;
                }))
            .doOnSuccess(best -> {
                progressStore.update(runId, p -> p.completed(best.fitness()));
                log.info("[PromptOptimizer] Run completed. runId={} bestFitness={} bestVersion={} evaluations={}",
                         runId, best.fitness(), best.version(), progressStore.get(runId).evaluationsRun());
            })
            .doOnError(e -> progressStore.update(runId, p -> p.failed(e.getMessage())));
        return RunContextUtil.withRunId(pipeline, runId);
    }

    // ── evolution ─────────────────────────────────────────────────────────────

    private Mono<PromptCandidate> evolve(Evolution run, PromptVersion seed) {
        PromptCandidate seedCandidate = new PromptCandidate(seed.content(), seed.version(), 0.0, 0, null);

        return Flux.range(1, run.settings.populationSize() - 1)
            .concatMap(i -> mutator.mutate(seed.content(), List.of(PromptMutator.EXPLORE_HINT), run.provider, run.runId)
                .map(content -> new PromptCandidate(content, run.nextVersion.getAndIncrement(), 0.0, 0, seed.version())))
            .collectList()
            .flatMap(mutants -> {
                List<PromptCandidate> initial = new ArrayList<>();
                initial.add(seedCandidate);
                initial.addAll(mutants);
                return evaluateAll(initial, run);
            })
            .doOnNext(evaluated -> {
                run.population = sorted(evaluated);
                run.best = run.population.get(0);
                progressStore.update(run.runId, p -> p.withBest(run.best));
                log.info("[PromptOptimizer] Initial population evaluated. runId={} size={} bestFitness={} seedFitness={}",
                         run.runId, evaluated.size(), run.best.fitness(), evaluated.get(0).fitness());
            })
            .thenMany(Flux.range(1, run.settings.generations())
                .concatMap(generation -> Mono.defer(() -> nextGeneration(generation, run))))
            .then()
            .then(Mono.fromSupplier(() -> run.best));
    }

    private Mono<Void> nextGeneration(int generation, Evolution run) {
        progressStore.update(run.runId, p -> p.atGeneration(generation));
        List<PromptCandidate> current = run.population;

        List<PromptCandidate> elites = current.stream()
            .limit(run.settings.eliteCount())
            .map(c -> c.withGeneration(generation))
            .toList();
        int offspring = Math.max(0, run.settings.populationSize() - elites.size());

        return Flux.range(0, offspring)
            .concatMap(i -> Mono.defer(() -> breed(current, generation, run)))
            .collectList()
            .flatMap(children -> evaluateAll(children, run))
            .doOnNext(children -> {
                List<PromptCandidate> next = new ArrayList<>(elites);
                next.addAll(children);
                run.population = sorted(next);

                PromptCandidate top = run.population.get(0);
                if (top.fitness() > run.best.fitness()) {
                    run.best = top;
                    progressStore.update(run.runId, p -> p.withBest(top));
                }
            })
            .doOnEach(RunContextUtil.logOnNext((runId, children) ->
                log.info("[PromptOptimizer] Generation complete. runId={} generation={}/{} offspring={} bestFitness={}",
                         runId, generation, run.settings.generations(), children.size(), run.best.fitness())))
            .then();
    }

    private Mono<PromptCandidate> breed(List<PromptCandidate> population, int generation, Evolution run) {
        PromptCandidate first  = tournamentSelect(population, run.settings.tournamentSize(), random);
        PromptCandidate second = tournamentSelect(population, run.settings.tournamentSize(), random);

        Mono<String> child;
        if (random.nextDouble() < run.settings.mutationRate()) {
            PromptCandidate parent = random.nextBoolean() ? first : second;
            List<EvalLead> quick = run.sample.subList(0, Math.min(QUICK_EVAL_SIZE, run.sample.size()));
            child = evaluator.evaluate(parent.content(), quick, run.provider, run.runId)
                .doOnNext(e -> recordEvaluation(run))
                .flatMap(e -> mutator.mutate(parent.content(), e.errors().hints(), run.provider, run.runId));
        } else {
            child = mutator.crossover(first.content(), second.content(), run.provider, run.runId);
        }
        return child.map(content ->
            new PromptCandidate(content, run.nextVersion.getAndIncrement(), 0.0, generation, first.version()));
    }

    private Mono<List<PromptCandidate>> evaluateAll(List<PromptCandidate> candidates, Evolution run) {
        return Flux.fromIterable(candidates)
            .concatMap(c -> evaluator.evaluate(c.content(), run.sample, run.provider, run.runId)
                .map(e -> c.withFitness(e.fitness()))
                .doOnNext(c2 -> recordEvaluation(run)))
            .collectList();
    }

    private void recordEvaluation(Evolution run) {
        int total = run.evaluations.incrementAndGet();
        progressStore.update(run.runId, p -> p.withEvaluations(total));
    }

    /**
     * Inserts the winner as an inactive prompt. Its in-run version is kept
     * unless another row already took it (the seed's own version, or a
     * concurrent run); then the next free version is used.
     */
    private Mono<PromptCandidate> persistBest(PromptCandidate best, String runId) {
        return promptStore.findMaxVersion()
            .map(max -> best.version() > max ? best : best.withVersion(max + 1))
            .flatMap(candidate -> promptStore.insert(PromptVersion.draft(candidate.version(), candidate.content(),
                    candidate.fitness(), false, candidate.generation(), candidate.parentVersion()))
                .thenReturn(candidate))
            .doOnSuccess(saved -> log.info("[PromptOptimizer] Best prompt saved inactive. runId={} version={} fitness={}",
                                           runId, saved.version(), saved.fitness()));
    }

    // ── selection helpers ─────────────────────────────────────────────────────

    /** Uniform sample without replacement when the pool exceeds {@code size}, otherwise the whole pool. */
    static List<EvalLead> sample(List<EvalLead> pool, int size, Random random) {
        List<EvalLead> copy = new ArrayList<>(pool);
        if (copy.size() <= size) {
            return copy;
        }
        Collections.shuffle(copy, random);
        return new ArrayList<>(copy.subList(0, size));
    }

    /** Best of {@code tournamentSize} uniform draws, with replacement. */
    static PromptCandidate tournamentSelect(List<PromptCandidate> population, int tournamentSize, Random random) {
        PromptCandidate winner = null;
        for (int i = 0; i < tournamentSize; i++) {
            PromptCandidate contender = population.get(random.nextInt(population.size()));
            if (winner == null || contender.fitness() > winner.fitness()) {
                winner = contender;
            }
        }
        return winner;
    }

    /** Stable: equal fitness keeps insertion order, so the seed and elites win ties. */
    static List<PromptCandidate> sorted(List<PromptCandidate> candidates) {
        List<PromptCandidate> copy = new ArrayList<>(candidates);
        copy.sort(BY_FITNESS_DESC);
        return List.copyOf(copy);
    }
}
