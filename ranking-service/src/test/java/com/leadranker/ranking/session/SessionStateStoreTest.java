package com.leadranker.ranking.session;

import com.leadranker.common.model.RankingChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionStateStoreTest {

    private SessionStateStore store;

    @BeforeEach
    void setUp() {
        store = new SessionStateStore();
    }

    @Test
    @DisplayName("reads on unknown or null sessions return empty values and create nothing")
    void unknownSession() {
        assertEquals(List.of(), store.getBatchIds("nope"));
        assertEquals(List.of(), store.getBatchIds(null));
        assertNull(store.getOptimizedPrompt("nope"));
        assertFalse(store.hasPendingOptimization("nope"));
        assertEquals(List.of(), store.getRankingChanges("nope"));
        assertEquals(0, store.sessionCount());
    }

    @Test
    @DisplayName("batch ids have set semantics and keep registration order")
    void batchIdsAreASet() {
        store.registerBatchId("s1", "batch_1");
        store.registerBatchId("s1", "batch_2");
        store.registerBatchId("s1", "batch_1");
        store.registerBatchId(null, "batch_3");

        assertEquals(List.of("batch_1", "batch_2"), store.getBatchIds("s1"));
        assertEquals(1, store.sessionCount());
    }

    @Test
    @DisplayName("setting an override raises the pending flag and drops stale changes")
    void overrideRaisesPending() {
        store.setRankingChanges("s1", List.of(new RankingChange("1", "Ann Lee", "Acme", 1, 2)));

        store.setOptimizedPrompt("s1", "better prompt");

        assertEquals("better prompt", store.getOptimizedPrompt("s1"));
        assertTrue(store.hasPendingOptimization("s1"));
        assertEquals(List.of(), store.getRankingChanges("s1"));
    }

    @Test
    @DisplayName("storing changes lowers the pending flag but keeps the override")
    void changesLowerPending() {
        store.setOptimizedPrompt("s1", "better prompt");
        RankingChange change = new RankingChange("1", "Ann Lee", "Acme", null, 3);

        store.setRankingChanges("s1", List.of(change));

        assertFalse(store.hasPendingOptimization("s1"));
        assertEquals(List.of(change), store.getRankingChanges("s1"));
        assertEquals("better prompt", store.getOptimizedPrompt("s1"));
    }

    @Test
    @DisplayName("pending flag can be cleared explicitly")
    void clearPending() {
        store.setOptimizedPrompt("s1", "p");
        store.clearPendingOptimization("s1");
        assertFalse(store.hasPendingOptimization("s1"));
    }
}
