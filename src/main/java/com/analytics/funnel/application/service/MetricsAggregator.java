package com.analytics.funnel.application.service;

import java.util.ArrayList;
import java.util.List;

import com.analytics.funnel.domain.analytics.FunnelAnalyticsResult;
import com.analytics.funnel.domain.analytics.StepAnalytics;
import com.analytics.funnel.domain.analytics.StepProgression;
import com.analytics.funnel.domain.entity.FunnelStep;

/**
 * Derives conversion and dropoff metrics from nested reached-sets.
 * <p>
 * Every division is guarded: a zero denominator yields a rate of 0. All
 * percentages are rounded to 2 decimals.
 * </p>
 */
public class MetricsAggregator {

    private static final double AVG_COMPLETION_TIME = 0;
    private static final String AVG_COMPLETION_TIME_FORMATTED = "0s";

    /**
     * @param progression reached-sets of the funnel
     * @param steps       funnel steps, in order, same count as the progression
     * @return funnel analytics
     */
    public FunnelAnalyticsResult aggregate(StepProgression progression, List<FunnelStep> steps) {
        if (steps.size() != progression.stepCount()) {
            throw new IllegalArgumentException(String.format(
                    "progression has %d steps but definition has %d",
                    progression.stepCount(), steps.size()));
        }

        long entered = progression.entered();
        long completed = progression.completed();
        List<StepAnalytics> stepsAnalytics = new ArrayList<>(steps.size());

        for (int i = 1; i <= steps.size(); i++) {
            long users = progression.count(i);
            double conversionRate;
            long dropoffs;
            double dropoffRate;

            if (i == 1) {
                conversionRate = entered > 0 ? 100.0 : 0;
                dropoffs = 0;
                dropoffRate = 0;
            } else {
                long previous = progression.count(i - 1);
                conversionRate = percentage(users, previous);
                dropoffs = previous - users;
                dropoffRate = percentage(dropoffs, previous);
            }

            stepsAnalytics.add(new StepAnalytics(i, steps.get(i - 1).getName(), users, entered,
                    conversionRate, dropoffs, dropoffRate));
        }

        StepAnalytics biggestDropoff = biggestDropoff(stepsAnalytics);

        return new FunnelAnalyticsResult(
                percentage(completed, entered),
                entered,
                completed,
                AVG_COMPLETION_TIME,
                AVG_COMPLETION_TIME_FORMATTED,
                biggestDropoff.getStepNumber(),
                biggestDropoff.getDropoffRate(),
                stepsAnalytics);
    }

    /**
     * {@code part / whole * 100}, rounded to 2 decimals, or 0 if whole is 0.
     */
    public double percentage(long part, long whole) {
        if (whole <= 0) {
            return 0;
        }
        return round((double) part / whole * 100);
    }

    /**
     * Rounds to 2 decimals, half up.
     */
    public double round(double value) {
        return Math.round(value * 100) / 100.0;
    }

    // First step after the entry step with the highest dropoff rate; step 1 for goals.
    private StepAnalytics biggestDropoff(List<StepAnalytics> stepsAnalytics) {
        if (stepsAnalytics.size() == 1) {
            return stepsAnalytics.get(0);
        }
        StepAnalytics biggest = stepsAnalytics.get(1);
        for (int i = 2; i < stepsAnalytics.size(); i++) {
            StepAnalytics candidate = stepsAnalytics.get(i);
            if (candidate.getDropoffRate() > biggest.getDropoffRate()) {
                biggest = candidate;
            }
        }
        return biggest;
    }
}
