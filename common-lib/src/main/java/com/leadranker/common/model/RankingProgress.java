package com.leadranker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Live progress of one ranking batch. Immutable; the progress store swaps
 * whole instances on every update.
 */
public record RankingProgress(
    @JsonProperty("total")          int       total,
    @JsonProperty("completed")      int       completed,
    @JsonProperty("currentCompany") String    currentCompany,
    @JsonProperty("status")         RunStatus status,
    @JsonProperty("error")          String    error
) {
    public static RankingProgress idle() {
        return new RankingProgress(0, 0, null, RunStatus.IDLE, null);
    }

    public RankingProgress started(int totalLeads) {
        return new RankingProgress(totalLeads, 0, null, RunStatus.RUNNING, null);
    }

    public RankingProgress onCompany(String companyName) {
        return new RankingProgress(total, completed, companyName, status, error);
    }

    public RankingProgress advancedBy(int leads) {
        return new RankingProgress(total, completed + leads, currentCompany, status, error);
    }

    public RankingProgress complete() {
        return new RankingProgress(total, completed, null, RunStatus.COMPLETED, error);
    }

    public RankingProgress failed(String message) {
        return new RankingProgress(total, completed, currentCompany, RunStatus.ERROR, message);
    }
}
