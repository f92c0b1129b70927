package com.analytics.funnel.domain.analytics;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a funnel analysis.
 * <p>
 * Never contains null fields: an empty entry cohort yields zero counts and
 * zero rates. {@code avg_completion_time} is not computed yet and is always 0.
 * </p>
 */
public final class FunnelAnalyticsResult {

    @JsonProperty("overall_conversion_rate")
    private final double overallConversionRate;

    @JsonProperty("total_users_entered")
    private final long totalUsersEntered;

    @JsonProperty("total_users_completed")
    private final long totalUsersCompleted;

    @JsonProperty("avg_completion_time")
    private final double avgCompletionTime;

    @JsonProperty("avg_completion_time_formatted")
    private final String avgCompletionTimeFormatted;

    @JsonProperty("biggest_dropoff_step")
    private final int biggestDropoffStep;

    @JsonProperty("biggest_dropoff_rate")
    private final double biggestDropoffRate;

    @JsonProperty("steps_analytics")
    private final List<StepAnalytics> stepsAnalytics;

    public FunnelAnalyticsResult(double overallConversionRate, long totalUsersEntered,
            long totalUsersCompleted, double avgCompletionTime, String avgCompletionTimeFormatted,
            int biggestDropoffStep, double biggestDropoffRate, List<StepAnalytics> stepsAnalytics) {
        this.overallConversionRate = overallConversionRate;
        this.totalUsersEntered = totalUsersEntered;
        this.totalUsersCompleted = totalUsersCompleted;
        this.avgCompletionTime = avgCompletionTime;
        this.avgCompletionTimeFormatted = avgCompletionTimeFormatted != null ? avgCompletionTimeFormatted : "0s";
        this.biggestDropoffStep = biggestDropoffStep;
        this.biggestDropoffRate = biggestDropoffRate;
        this.stepsAnalytics = stepsAnalytics != null ? List.copyOf(stepsAnalytics) : List.of();
    }

    public double getOverallConversionRate() {
        return overallConversionRate;
    }

    public long getTotalUsersEntered() {
        return totalUsersEntered;
    }

    public long getTotalUsersCompleted() {
        return totalUsersCompleted;
    }

    public double getAvgCompletionTime() {
        return avgCompletionTime;
    }

    public String getAvgCompletionTimeFormatted() {
        return avgCompletionTimeFormatted;
    }

    public int getBiggestDropoffStep() {
        return biggestDropoffStep;
    }

    public double getBiggestDropoffRate() {
        return biggestDropoffRate;
    }

    public List<StepAnalytics> getStepsAnalytics() {
        return stepsAnalytics;
    }

    /**
     * @param stepNumber 1-based step number
     * @return analytics of that step
     */
    public StepAnalytics step(int stepNumber) {
        return stepsAnalytics.get(stepNumber - 1);
    }

    @Override
    public String toString() {
        return "FunnelAnalyticsResult{entered=" + totalUsersEntered + ", completed=" + totalUsersCompleted
                + ", conversion=" + overallConversionRate + ", biggestDropoffStep=" + biggestDropoffStep + "}";
    }
}
