package com.leadranker.ranking.progress;

import java.util.UUID;

/** Run identifiers: a prefix, the start time in epoch millis and a short random suffix. */
public final class RunIds {

    public static final String BATCH_PREFIX        = "batch_";
    public static final String OPTIMIZATION_PREFIX = "opt_";

    private RunIds() {}

    public static String newBatchId() {
        return next(BATCH_PREFIX);
    }

    public static String newOptimizationRunId() {
        return next(OPTIMIZATION_PREFIX);
    }

    private static String next(String prefix) {
        return prefix + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 6);
    }
}
