package com.leadranker.ranking.store;

/** A lead's currently persisted rank; {@code rank} null means irrelevant. */
public record LeadRank(String leadId, Integer rank) {}
