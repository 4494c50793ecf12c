package com.leadranker.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;
import reactor.util.context.ContextView;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Carries the batch/run id of a background run through its Reactor pipeline.
 *
 * <p>Reactor Context is the source of truth for the run id. MDC is only written
 * as a temporary bridge around a single log statement, never left on the thread.
 *
 * <pre>
 *     step.doOnEach(RunContextUtil.logOnNext((runId, value) -> log.info("... runId={}", runId)));
 *     return RunContextUtil.withRunId(pipeline, batchId);
 * </pre>
 */
public final class RunContextUtil {

    public static final String RUN_ID_KEY = "runId";

    private RunContextUtil() {}

    /**
     * Stores {@code runId} in the Reactor Context. Call at the end of pipeline
     * assembly; {@code contextWrite} propagates upstream during subscription.
     */
    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** Returns the run id from {@code ctx}, or {@code "unknown"}; never {@code null}. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, "unknown");
    }

    /**
     * {@code doOnEach} hook: runs {@code logAction} for every onNext with the
     * context's run id, which is also in MDC while the action runs.
     */
    public static <T> Consumer<Signal<T>> logOnNext(BiConsumer<String, T> logAction) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String runId = getRunId(signal.getContextView());
            withMdc(runId, () -> logAction.accept(runId, signal.get()));
        };
    }

    /** Bridges {@code runId} into MDC for the duration of {@code logAction} only. */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
