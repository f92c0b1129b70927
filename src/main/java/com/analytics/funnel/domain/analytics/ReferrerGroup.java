package com.analytics.funnel.domain.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Funnel conversion of the sessions attributed to one canonical referrer.
 */
public final class ReferrerGroup {

    @JsonProperty("referrer")
    private final String referrer;

    @JsonProperty("referrer_parsed")
    private final ReferrerInfo referrerParsed;

    @JsonProperty("total_users")
    private final long totalUsers;

    @JsonProperty("completed_users")
    private final long completedUsers;

    @JsonProperty("conversion_rate")
    private final double conversionRate;

    public ReferrerGroup(String referrer, ReferrerInfo referrerParsed, long totalUsers,
            long completedUsers, double conversionRate) {
        this.referrer = referrer;
        this.referrerParsed = referrerParsed;
        this.totalUsers = totalUsers;
        this.completedUsers = completedUsers;
        this.conversionRate = conversionRate;
    }

    /** @return canonical domain key, or "direct" */
    public String getReferrer() {
        return referrer;
    }

    public ReferrerInfo getReferrerParsed() {
        return referrerParsed;
    }

    public long getTotalUsers() {
        return totalUsers;
    }

    public long getCompletedUsers() {
        return completedUsers;
    }

    public double getConversionRate() {
        return conversionRate;
    }

    @Override
    public String toString() {
        return "ReferrerGroup{referrer='" + referrer + "', total=" + totalUsers
                + ", completed=" + completedUsers + ", conversion=" + conversionRate + "}";
    }
}
