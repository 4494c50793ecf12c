package com.leadranker.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle of a background run: {@code IDLE → RUNNING → COMPLETED | ERROR}. */
public enum RunStatus {
    IDLE, RUNNING, COMPLETED, ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
