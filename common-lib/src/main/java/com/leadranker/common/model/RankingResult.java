package com.leadranker.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One parsed ranking per lead. A {@code null} rank marks the lead as irrelevant;
 * unparseable entries also carry a null rank together with
 * {@link #PARSE_FAILURE_REASONING}.
 */
public record RankingResult(
    @JsonProperty("leadId")    String  leadId,
    @JsonProperty("rank")      Integer rank,
    @JsonProperty("reasoning") String  reasoning
) {
    public static final String PARSE_FAILURE_REASONING = "Failed to parse ranking from AI response";

    public static RankingResult failed(String leadId) {
        return new RankingResult(leadId, null, PARSE_FAILURE_REASONING);
    }

    public boolean isRelevant() {
        return rank != null;
    }

    /** Stored relevance score: {@code (11 - rank) / 10} when ranked, otherwise 0. */
    public double relevanceScore() {
        return rank != null ? (11 - rank) / 10.0 : 0.0;
    }
}
