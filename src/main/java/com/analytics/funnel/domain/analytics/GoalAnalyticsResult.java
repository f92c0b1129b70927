package com.analytics.funnel.domain.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Goal analysis: the single-step funnel result plus conversion measured
 * against every session that viewed a page of the website in range.
 */
public final class GoalAnalyticsResult {

    @JsonProperty("goal_id")
    private final String goalId;

    @JsonProperty("analytics")
    private final FunnelAnalyticsResult analytics;

    @JsonProperty("total_website_users")
    private final long totalWebsiteUsers;

    @JsonProperty("website_conversion_rate")
    private final double websiteConversionRate;

    public GoalAnalyticsResult(String goalId, FunnelAnalyticsResult analytics,
            long totalWebsiteUsers, double websiteConversionRate) {
        this.goalId = goalId;
        this.analytics = analytics;
        this.totalWebsiteUsers = totalWebsiteUsers;
        this.websiteConversionRate = websiteConversionRate;
    }

    public String getGoalId() {
        return goalId;
    }

    public FunnelAnalyticsResult getAnalytics() {
        return analytics;
    }

    /** @return sessions that reached the goal */
    @JsonProperty("goal_completions")
    public long getGoalCompletions() {
        return analytics.getTotalUsersCompleted();
    }

    public long getTotalWebsiteUsers() {
        return totalWebsiteUsers;
    }

    public double getWebsiteConversionRate() {
        return websiteConversionRate;
    }

    @Override
    public String toString() {
        return "GoalAnalyticsResult{goalId='" + goalId + "', completions=" + getGoalCompletions()
                + ", websiteUsers=" + totalWebsiteUsers + ", conversion=" + websiteConversionRate + "}";
    }
}
