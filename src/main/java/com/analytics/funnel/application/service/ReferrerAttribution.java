package com.analytics.funnel.application.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.analytics.funnel.domain.analytics.ReferrerAnalyticsResult;
import com.analytics.funnel.domain.analytics.ReferrerGroup;
import com.analytics.funnel.domain.analytics.ReferrerInfo;
import com.analytics.funnel.domain.analytics.StepProgression;
import com.analytics.funnel.domain.entity.SessionStepOccurrence;

/**
 * Attributes funnel conversion to each session's first referrer.
 * <p>
 * Sessions are partitioned by raw first referrer, the progression engine is
 * re-run per partition, and partitions that canonicalize to the same domain
 * are merged. A merged group sums users and reports the arithmetic mean of
 * its partitions' conversion rates, not the pooled rate.
 * </p>
 */
public class ReferrerAttribution {

    private static final Logger log = LoggerFactory.getLogger(ReferrerAttribution.class);

    private static final Comparator<ReferrerGroup> BY_TOTAL_USERS_DESC = Comparator
            .comparingLong(ReferrerGroup::getTotalUsers).reversed()
            .thenComparing(ReferrerGroup::getReferrer);

    private final FunnelProgressionEngine progressionEngine;
    private final MetricsAggregator metricsAggregator;
    private final ReferrerCanonicalizer canonicalizer;

    public ReferrerAttribution(FunnelProgressionEngine progressionEngine,
            MetricsAggregator metricsAggregator,
            ReferrerCanonicalizer canonicalizer) {
        if (progressionEngine == null)
            throw new IllegalArgumentException("progressionEngine cannot be null");
        if (metricsAggregator == null)
            throw new IllegalArgumentException("metricsAggregator cannot be null");
        if (canonicalizer == null)
            throw new IllegalArgumentException("canonicalizer cannot be null");

        this.progressionEngine = progressionEngine;
        this.metricsAggregator = metricsAggregator;
        this.canonicalizer = canonicalizer;
    }

    /**
     * @param bySession      session id → step rows
     * @param firstReferrers session id → first referrer across all its events
     * @param stepCount      number of funnel steps K
     * @param siteHost       the site's own hostname, may be null
     * @return referrer groups, largest first; groups without entrants omitted
     */
    public ReferrerAnalyticsResult attribute(Map<String, List<SessionStepOccurrence>> bySession,
            Map<String, String> firstReferrers, int stepCount, String siteHost) {
        Map<String, Set<String>> partitions = partitionByReferrer(bySession, firstReferrers);

        Map<String, GroupAccumulator> groups = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> partition : partitions.entrySet()) {
            StepProgression progression = progressionEngine.progress(bySession, partition.getValue(), stepCount);
            long total = progression.entered();
            if (total == 0) {
                continue;
            }
            long completed = progression.completed();
            double rate = metricsAggregator.percentage(completed, total);

            ReferrerInfo parsed = canonicalizer.canonicalize(partition.getKey(), siteHost);
            groups.computeIfAbsent(parsed.groupKey(), key -> new GroupAccumulator())
                    .add(parsed, total, completed, rate);
        }

        List<ReferrerGroup> result = new ArrayList<>(groups.size());
        for (Map.Entry<String, GroupAccumulator> group : groups.entrySet()) {
            result.add(group.getValue().toGroup(group.getKey(), metricsAggregator));
        }
        result.sort(BY_TOTAL_USERS_DESC);

        log.debug("action=referrer_attribution partitions={} groups={}", partitions.size(), result.size());
        return new ReferrerAnalyticsResult(result);
    }

    // Sessions without a first referrer fall back to the referrer on their earliest step row.
    private Map<String, Set<String>> partitionByReferrer(Map<String, List<SessionStepOccurrence>> bySession,
            Map<String, String> firstReferrers) {
        Map<String, Set<String>> partitions = new LinkedHashMap<>();
        for (Map.Entry<String, List<SessionStepOccurrence>> session : bySession.entrySet()) {
            String referrer = firstReferrers.get(session.getKey());
            if (referrer == null || referrer.isBlank()) {
                referrer = earliestRowReferrer(session.getValue());
            }
            partitions.computeIfAbsent(referrer.trim(), r -> new LinkedHashSet<>()).add(session.getKey());
        }
        return partitions;
    }

    private String earliestRowReferrer(List<SessionStepOccurrence> rows) {
        return rows.stream()
                .min(Comparator.comparing(SessionStepOccurrence::getFirstOccurrence))
                .flatMap(SessionStepOccurrence::getReferrer)
                .orElse("");
    }

    /**
     * Running totals of the partitions sharing one canonical key.
     */
    private static final class GroupAccumulator {

        private ReferrerInfo parsed;
        private long largestPartition = -1;
        private long totalUsers;
        private long completedUsers;
        private double rateSum;
        private int rateCount;

        void add(ReferrerInfo partitionInfo, long total, long completed, double rate) {
            if (total > largestPartition) {
                parsed = partitionInfo;
                largestPartition = total;
            }
            totalUsers += total;
            completedUsers += completed;
            rateSum += rate;
            rateCount++;
        }

        ReferrerGroup toGroup(String key, MetricsAggregator aggregator) {
            double meanRate = rateCount > 0 ? aggregator.round(rateSum / rateCount) : 0;
            return new ReferrerGroup(key, parsed, totalUsers, completedUsers, meanRate);
        }
    }
}
