package com.leadranker.ranking.store;

import com.leadranker.common.model.RankingResult;

public record RankingRecord(String leadId, Integer rank, double relevanceScore,
                            String reasoning, int promptVersion) {

    public static RankingRecord of(RankingResult result, int promptVersion) {
        return new RankingRecord(result.leadId(), result.rank(), result.relevanceScore(),
                                 result.reasoning(), promptVersion);
    }
}
