package com.leadranker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Rank delta for one lead between two ranking runs of the same session. */
public record RankingChange(
    @JsonProperty("leadId")   String  leadId,
    @JsonProperty("fullName") String  fullName,
    @JsonProperty("company")  String  company,
    @JsonProperty("oldRank")  Integer oldRank,
    @JsonProperty("newRank")  Integer newRank
) {}
