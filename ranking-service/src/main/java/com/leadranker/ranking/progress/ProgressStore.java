package com.leadranker.ranking.progress;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * In-memory progress records keyed by run id. Entries live for the life of
 * the process; unknown ids read as the idle record.
 *
 * @param <P> immutable progress snapshot type
 */
public class ProgressStore<P> {

    private final Map<String, P> entries = new ConcurrentHashMap<>();
    private final Supplier<P> idle;

    public ProgressStore(Supplier<P> idle) {
        this.idle = idle;
    }

    public P get(String runId) {
        P current = entries.get(runId);
        return current != null ? current : idle.get();
    }

    public boolean contains(String runId) {
        return entries.containsKey(runId);
    }

    /** Atomically replaces the entry with {@code change} applied to it (or to idle). */
    public P update(String runId, UnaryOperator<P> change) {
        return entries.compute(runId, (id, current) -> change.apply(current != null ? current : idle.get()));
    }
}
