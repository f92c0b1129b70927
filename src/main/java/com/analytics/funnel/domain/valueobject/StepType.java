package com.analytics.funnel.domain.valueobject;

import java.util.Locale;

/**
 * Classification of funnel steps.
 * <p>
 * A step is matched either against page views (by path) or against named
 * events. EVENT and CUSTOM currently resolve to the same event-name predicate.
 * </p>
 */
public enum StepType {

    /** Matched against the path of page-view events */
    PAGE_VIEW,

    /** Matched against the event name */
    EVENT,

    /** Matched against the event name (same predicate as EVENT) */
    CUSTOM;

    /**
     * Parses a stored step type, accepting "PAGE_VIEW", "page_view" or "PageView".
     *
     * @param value raw type name
     * @return the step type
     * @throws IllegalArgumentException if the value is not a known type
     */
    public static StepType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("step type cannot be null or blank");
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .toUpperCase(Locale.ROOT);
        return StepType.valueOf(normalized);
    }
}
