package com.analytics.funnel.domain.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-step funnel metrics. Rates are percentages rounded to 2 decimals.
 */
public final class StepAnalytics {

    @JsonProperty("step_number")
    private final int stepNumber;

    @JsonProperty("step_name")
    private final String stepName;

    @JsonProperty("users")
    private final long users;

    @JsonProperty("total_users")
    private final long totalUsers;

    @JsonProperty("conversion_rate")
    private final double conversionRate;

    @JsonProperty("dropoffs")
    private final long dropoffs;

    @JsonProperty("dropoff_rate")
    private final double dropoffRate;

    public StepAnalytics(int stepNumber, String stepName, long users, long totalUsers,
            double conversionRate, long dropoffs, double dropoffRate) {
        this.stepNumber = stepNumber;
        this.stepName = stepName;
        this.users = users;
        this.totalUsers = totalUsers;
        this.conversionRate = conversionRate;
        this.dropoffs = dropoffs;
        this.dropoffRate = dropoffRate;
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public String getStepName() {
        return stepName;
    }

    public long getUsers() {
        return users;
    }

    public long getTotalUsers() {
        return totalUsers;
    }

    public double getConversionRate() {
        return conversionRate;
    }

    public long getDropoffs() {
        return dropoffs;
    }

    public double getDropoffRate() {
        return dropoffRate;
    }

    @Override
    public String toString() {
        return "StepAnalytics{step=" + stepNumber + ", users=" + users
                + ", conversion=" + conversionRate + ", dropoff=" + dropoffRate + "}";
    }
}
