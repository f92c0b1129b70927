package com.analytics.funnel.domain.entity;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * First occurrence of one funnel step within one session.
 * <p>
 * One row exists per session per step that matched at least once in the
 * queried range. The referrer is only populated on the attribution path.
 * </p>
 */
public final class SessionStepOccurrence {

    private final String sessionId;
    private final int stepNumber;
    private final Instant firstOccurrence;
    private final String referrer;

    public SessionStepOccurrence(String sessionId, int stepNumber, Instant firstOccurrence, String referrer) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (stepNumber < 1) {
            throw new IllegalArgumentException("stepNumber must be >= 1, got " + stepNumber);
        }
        if (firstOccurrence == null) {
            throw new IllegalArgumentException("firstOccurrence cannot be null");
        }
        this.sessionId = sessionId;
        this.stepNumber = stepNumber;
        this.firstOccurrence = firstOccurrence;
        this.referrer = referrer;
    }

    public SessionStepOccurrence(String sessionId, int stepNumber, Instant firstOccurrence) {
        this(sessionId, stepNumber, firstOccurrence, null);
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public Instant getFirstOccurrence() {
        return firstOccurrence;
    }

    public Optional<String> getReferrer() {
        return Optional.ofNullable(referrer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SessionStepOccurrence that = (SessionStepOccurrence) o;
        return stepNumber == that.stepNumber
                && sessionId.equals(that.sessionId)
                && firstOccurrence.equals(that.firstOccurrence)
                && Objects.equals(referrer, that.referrer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, stepNumber, firstOccurrence, referrer);
    }

    @Override
    public String toString() {
        return "SessionStepOccurrence{sessionId='" + sessionId + "', step=" + stepNumber
                + ", at=" + firstOccurrence + "}";
    }
}
