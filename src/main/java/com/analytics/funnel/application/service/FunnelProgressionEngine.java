package com.analytics.funnel.application.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.analytics.funnel.domain.analytics.StepProgression;
import com.analytics.funnel.domain.entity.SessionStepOccurrence;

/**
 * Strict-order funnel automaton.
 * <p>
 * Each session holds a cursor {@code expected}, starting at step 1. Its rows
 * are scanned in time order; a row for the expected step credits the session
 * and advances the cursor, any other row is ignored. A session can therefore
 * never be credited for step N without having been credited for steps 1..N-1
 * earlier in its own timeline.
 * </p>
 *
 * <pre>
 *   rows (2,t1) (1,t2) (3,t3)  →  expected: 1 → 2   (reached step 1 only)
 * </pre>
 *
 * <p>
 * <b>Thread-safe:</b> This service has no mutable state.
 * </p>
 * <p>
 * <b>Deterministic:</b> rows with equal timestamps are ordered by step number.
 * </p>
 */
public class FunnelProgressionEngine {

    private static final Comparator<SessionStepOccurrence> TIMELINE = Comparator
            .comparing(SessionStepOccurrence::getFirstOccurrence)
            .thenComparingInt(SessionStepOccurrence::getStepNumber);

    /**
     * Groups rows by session, keeping first-seen session order.
     *
     * @param rows union of all step rows
     * @return session id → that session's rows
     */
    public Map<String, List<SessionStepOccurrence>> groupBySession(Collection<SessionStepOccurrence> rows) {
        Map<String, List<SessionStepOccurrence>> bySession = new LinkedHashMap<>();
        for (SessionStepOccurrence row : rows) {
            bySession.computeIfAbsent(row.getSessionId(), id -> new ArrayList<>()).add(row);
        }
        return bySession;
    }

    /**
     * Runs the automaton over every session.
     *
     * @param bySession session id → rows
     * @param stepCount number of funnel steps K
     * @return nested reached-sets
     */
    public StepProgression progress(Map<String, List<SessionStepOccurrence>> bySession, int stepCount) {
        return progress(bySession, bySession.keySet(), stepCount);
    }

    /**
     * Runs the automaton over a subset of sessions.
     *
     * @param bySession  session id → rows
     * @param sessionIds sessions to include; ids without rows are skipped
     * @param stepCount  number of funnel steps K
     * @return nested reached-sets of the subset
     */
    public StepProgression progress(Map<String, List<SessionStepOccurrence>> bySession,
            Set<String> sessionIds, int stepCount) {
        StepProgression progression = StepProgression.empty(stepCount);
        for (String sessionId : sessionIds) {
            List<SessionStepOccurrence> rows = bySession.get(sessionId);
            if (rows != null && !rows.isEmpty()) {
                advance(sessionId, rows, stepCount, progression);
            }
        }
        return progression;
    }

    private void advance(String sessionId, List<SessionStepOccurrence> rows, int stepCount,
            StepProgression progression) {
        List<SessionStepOccurrence> timeline = new ArrayList<>(rows);
        timeline.sort(TIMELINE);

        int expected = 1;
        for (SessionStepOccurrence row : timeline) {
            if (expected > stepCount) {
                break;
            }
            if (row.getStepNumber() == expected) {
                progression.credit(sessionId, expected);
                expected++;
            }
        }
    }
}
