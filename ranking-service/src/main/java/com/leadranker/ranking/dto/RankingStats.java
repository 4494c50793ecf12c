package com.leadranker.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.leadranker.ranking.store.CostSummary;

public record RankingStats(
    @JsonProperty("totalLeads")      long        totalLeads,
    @JsonProperty("rankedLeads")     long        rankedLeads,
    @JsonProperty("relevantLeads")   long        relevantLeads,
    @JsonProperty("irrelevantLeads") long        irrelevantLeads,
    @JsonProperty("aiCalls")         CostSummary aiCalls
) {}
