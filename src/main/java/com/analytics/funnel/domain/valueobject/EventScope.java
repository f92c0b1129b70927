package com.analytics.funnel.domain.valueobject;

import java.time.LocalDateTime;

/**
 * Tenant and time window every event log query is restricted to.
 */
public final class EventScope {

    private final String websiteId;
    private final LocalDateTime from;
    private final LocalDateTime to;

    public EventScope(String websiteId, LocalDateTime from, LocalDateTime to) {
        if (websiteId == null || websiteId.isBlank()) {
            throw new IllegalArgumentException("websiteId cannot be null or blank");
        }
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to cannot be null");
        }
        this.websiteId = websiteId;
        this.from = from;
        this.to = to;
    }

    public static EventScope of(String websiteId, DateRange range) {
        return new EventScope(websiteId, range.getFrom(), range.getTo());
    }

    /** @return true if no timestamp can fall inside the window */
    public boolean isEmpty() {
        return from.isAfter(to);
    }

    public String getWebsiteId() {
        return websiteId;
    }

    /** @return inclusive lower bound */
    public LocalDateTime getFrom() {
        return from;
    }

    /** @return inclusive upper bound */
    public LocalDateTime getTo() {
        return to;
    }

    @Override
    public String toString() {
        return "EventScope{websiteId='" + websiteId + "', from=" + from + ", to=" + to + "}";
    }
}
