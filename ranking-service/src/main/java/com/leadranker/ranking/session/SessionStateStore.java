package com.leadranker.ranking.session;

import com.leadranker.common.model.RankingChange;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-browser-session scratch state: the run ids started by the session, an
 * optimized prompt that overrides the canonical one for the session's ranking
 * runs, and the rank deltas of the first run after that override was set.
 *
 * <p>States are created lazily and never evicted. Read operations on unknown
 * or null session ids return empty values without creating state.
 */
@Component
public class SessionStateStore {

    private static final class SessionState {
        private final Set<String> batchIds = Collections.synchronizedSet(new LinkedHashSet<>());
        private volatile String optimizedPrompt;
        private volatile boolean pendingOptimization;
        private volatile List<RankingChange> rankingChanges = List.of();
    }

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    private SessionState state(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> new SessionState());
    }

    private Optional<SessionState> existing(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public void registerBatchId(String sessionId, String batchId) {
        if (sessionId == null) return;
        state(sessionId).batchIds.add(batchId);
    }

    public List<String> getBatchIds(String sessionId) {
        return existing(sessionId)
            .map(s -> {
                synchronized (s.batchIds) {
                    return List.copyOf(s.batchIds);
                }
            })
            .orElse(List.of());
    }

    /** Sets the override, raises the pending flag and drops changes from an earlier override. */
    public void setOptimizedPrompt(String sessionId, String prompt) {
        SessionState s = state(sessionId);
        s.optimizedPrompt     = prompt;
        s.rankingChanges      = List.of();
        s.pendingOptimization = true;
    }

    public String getOptimizedPrompt(String sessionId) {
        return existing(sessionId).map(s -> s.optimizedPrompt).orElse(null);
    }

    public boolean hasPendingOptimization(String sessionId) {
        return existing(sessionId).map(s -> s.pendingOptimization).orElse(false);
    }

    public void clearPendingOptimization(String sessionId) {
        existing(sessionId).ifPresent(s -> s.pendingOptimization = false);
    }

    /** Stores the deltas and lowers the pending flag. */
    public void setRankingChanges(String sessionId, List<RankingChange> changes) {
        SessionState s = state(sessionId);
        s.rankingChanges      = List.copyOf(changes);
        s.pendingOptimization = false;
    }

    public List<RankingChange> getRankingChanges(String sessionId) {
        return existing(sessionId).map(s -> s.rankingChanges).orElse(List.of());
    }

    int sessionCount() {
        return sessions.size();
    }
}
