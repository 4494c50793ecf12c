package com.leadranker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Human-labelled evaluation row. {@code expectedRank == null} means the lead
 * was labelled irrelevant ("-" in the evaluation CSV).
 */
public record EvalLead(
    @JsonProperty("fullName")      String  fullName,
    @JsonProperty("title")         String  title,
    @JsonProperty("company")       String  company,
    @JsonProperty("linkedInUrl")   String  linkedInUrl,
    @JsonProperty("employeeRange") String  employeeRange,
    @JsonProperty("expectedRank")  Integer expectedRank
) {
    public boolean isRelevant() {
        return expectedRank != null;
    }
}
