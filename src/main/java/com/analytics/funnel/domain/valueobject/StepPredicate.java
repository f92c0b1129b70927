package com.analytics.funnel.domain.valueobject;

import java.util.Optional;

/**
 * Match predicate of a single funnel step.
 * <p>
 * An event matches when its name equals {@link #getEventName()} and, if a path
 * target is present, its path equals or contains that target.
 * </p>
 */
public final class StepPredicate {

    private final String eventName;
    private final String pathTarget;

    private StepPredicate(String eventName, String pathTarget) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName cannot be null or blank");
        }
        this.eventName = eventName;
        this.pathTarget = pathTarget;
    }

    /**
     * Page views whose path equals or contains the target.
     */
    public static StepPredicate pageView(String pageViewEventName, String pathTarget) {
        if (pathTarget == null) {
            throw new IllegalArgumentException("pathTarget cannot be null");
        }
        return new StepPredicate(pageViewEventName, pathTarget);
    }

    /**
     * Events with the given name.
     */
    public static StepPredicate eventNamed(String eventName) {
        return new StepPredicate(eventName, null);
    }

    public String getEventName() {
        return eventName;
    }

    public Optional<String> getPathTarget() {
        return Optional.ofNullable(pathTarget);
    }

    @Override
    public String toString() {
        return pathTarget == null
                ? "event_name=" + eventName
                : "event_name=" + eventName + " path~" + pathTarget;
    }
}
