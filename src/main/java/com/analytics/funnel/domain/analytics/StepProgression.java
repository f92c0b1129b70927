package com.analytics.funnel.domain.analytics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reached-sets of a funnel: for every step, the sessions that satisfied it in
 * strict order.
 * <p>
 * <b>Invariant:</b> {@code reached(K) ⊆ reached(K-1) ⊆ … ⊆ reached(1)}. The
 * only way to add a session at step N is {@link #credit}, which requires the
 * session to already hold step N-1.
 * </p>
 */
public final class StepProgression {

    private final List<Set<String>> reached;
    private final Map<String, Integer> furthestStep;

    private StepProgression(int stepCount) {
        this.reached = new ArrayList<>(stepCount);
        for (int i = 0; i < stepCount; i++) {
            reached.add(new LinkedHashSet<>());
        }
        this.furthestStep = new LinkedHashMap<>();
    }

    /**
     * Creates an empty progression for a funnel of {@code stepCount} steps.
     */
    public static StepProgression empty(int stepCount) {
        if (stepCount < 1) {
            throw new IllegalArgumentException("stepCount must be >= 1, got " + stepCount);
        }
        return new StepProgression(stepCount);
    }

    /**
     * Credits a session for a step.
     *
     * @throws IllegalStateException if the session has not reached the previous step
     */
    public void credit(String sessionId, int stepNumber) {
        int current = furthestStep.getOrDefault(sessionId, 0);
        if (stepNumber != current + 1) {
            throw new IllegalStateException(String.format(
                    "session %s cannot reach step %d from step %d", sessionId, stepNumber, current));
        }
        reached.get(stepNumber - 1).add(sessionId);
        furthestStep.put(sessionId, stepNumber);
    }

    public int stepCount() {
        return reached.size();
    }

    /**
     * @param stepNumber 1-based step number
     * @return sessions that reached the step
     */
    public Set<String> reached(int stepNumber) {
        return Collections.unmodifiableSet(reached.get(stepNumber - 1));
    }

    /** @return size of the reached-set of the step */
    public int count(int stepNumber) {
        return reached.get(stepNumber - 1).size();
    }

    /** @return sessions that reached step 1 */
    public int entered() {
        return count(1);
    }

    /** @return sessions that reached the last step */
    public int completed() {
        return count(stepCount());
    }

    /**
     * @return furthest step reached by each session that entered the funnel
     */
    public Map<String, Integer> furthestSteps() {
        return Collections.unmodifiableMap(furthestStep);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StepProgression{");
        for (int i = 0; i < reached.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(i + 1).append('=').append(reached.get(i).size());
        }
        return sb.append('}').toString();
    }
}
