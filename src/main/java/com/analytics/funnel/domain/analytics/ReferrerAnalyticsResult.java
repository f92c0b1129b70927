package com.analytics.funnel.domain.analytics;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Referrer-attributed funnel conversion, sorted by total users descending.
 */
public final class ReferrerAnalyticsResult {

    @JsonProperty("referrer_analytics")
    private final List<ReferrerGroup> referrerAnalytics;

    public ReferrerAnalyticsResult(List<ReferrerGroup> referrerAnalytics) {
        this.referrerAnalytics = referrerAnalytics != null ? List.copyOf(referrerAnalytics) : List.of();
    }

    public List<ReferrerGroup> getReferrerAnalytics() {
        return referrerAnalytics;
    }

    public Optional<ReferrerGroup> group(String referrerKey) {
        return referrerAnalytics.stream()
                .filter(g -> g.getReferrer().equals(referrerKey))
                .findFirst();
    }
}
