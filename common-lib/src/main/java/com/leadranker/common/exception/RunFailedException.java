package com.leadranker.common.exception;

/**
 * Run-fatal failure of a ranking batch or optimizer run. Per-company and
 * per-evaluation failures never surface as this exception.
 */
public class RunFailedException extends RuntimeException {
    private final String runId;

    public RunFailedException(String runId, String message) {
        super("[" + runId + "] " + message);
        this.runId = runId;
    }

    public RunFailedException(String runId, String message, Throwable cause) {
        super("[" + runId + "] " + message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
