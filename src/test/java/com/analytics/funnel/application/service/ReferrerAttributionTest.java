package com.analytics.funnel.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.analytics.funnel.adapters.out.registry.JsonReferrerRegistry;
import com.analytics.funnel.domain.analytics.ReferrerAnalyticsResult;
import com.analytics.funnel.domain.analytics.ReferrerGroup;
import com.analytics.funnel.domain.entity.SessionStepOccurrence;
import com.analytics.funnel.domain.valueobject.KnownReferrer;
import com.analytics.funnel.domain.valueobject.ReferrerType;

class ReferrerAttributionTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final String GOOGLE_SEARCH = "https://www.google.com/search?q=a";
    private static final String GOOGLE_HOME = "https://google.com";

    private final FunnelProgressionEngine engine = new FunnelProgressionEngine();
    private final MetricsAggregator aggregator = new MetricsAggregator();
    private final ReferrerAttribution attribution = new ReferrerAttribution(engine, aggregator,
            new ReferrerCanonicalizer(new JsonReferrerRegistry(Map.of(
                    "google.com", new KnownReferrer("google.com", ReferrerType.SEARCH, "Google"),
                    "facebook.com", new KnownReferrer("facebook.com", ReferrerType.SOCIAL, "Facebook")))));

    @Test
    void mergedGroupReportsMeanOfPartitionRates() {
        Map<String, List<SessionStepOccurrence>> bySession = engine.groupBySession(List.of(
                row("g1", 1, 0, null), row("g1", 2, 10, null),
                row("g2", 1, 0, null),
                row("g3", 1, 0, null), row("g3", 2, 10, null)));
        Map<String, String> firstReferrers = Map.of(
                "g1", GOOGLE_SEARCH,
                "g2", GOOGLE_SEARCH,
                "g3", GOOGLE_HOME);

        ReferrerAnalyticsResult result = attribution.attribute(bySession, firstReferrers, 2, "example.com");

        ReferrerGroup google = result.group("google.com").orElseThrow();
        assertEquals(3, google.getTotalUsers());
        assertEquals(2, google.getCompletedUsers());
        // (50 + 100) / 2, not the pooled 66.67
        assertEquals(75.0, google.getConversionRate());
        assertEquals(GOOGLE_SEARCH, google.getReferrerParsed().getUrl());
        assertEquals("Google", google.getReferrerParsed().getName());
    }

    @Test
    void sessionsWithoutReferrerFallBackToStepRowsThenDirect() {
        Map<String, List<SessionStepOccurrence>> bySession = engine.groupBySession(List.of(
                row("f1", 1, 0, "https://facebook.com/"), row("f1", 2, 10, "https://other.org/"),
                row("d1", 1, 0, null)));

        ReferrerAnalyticsResult result = attribution.attribute(bySession, Map.of(), 2, null);

        ReferrerGroup facebook = result.group("facebook.com").orElseThrow();
        assertEquals(1, facebook.getTotalUsers());
        assertEquals(100.0, facebook.getConversionRate());

        ReferrerGroup direct = result.group("direct").orElseThrow();
        assertEquals(1, direct.getTotalUsers());
        assertEquals(0.0, direct.getConversionRate());
        assertEquals(ReferrerType.DIRECT, direct.getReferrerParsed().getType());
    }

    @Test
    void partitionsWithoutEntrantsAreOmittedAndGroupsSorted() {
        Map<String, List<SessionStepOccurrence>> bySession = engine.groupBySession(List.of(
                row("g1", 1, 0, null),
                row("g2", 1, 0, null),
                row("r1", 2, 0, null),
                row("d1", 1, 0, null),
                row("b1", 1, 0, null)));
        Map<String, String> firstReferrers = Map.of(
                "g1", GOOGLE_HOME,
                "g2", GOOGLE_SEARCH,
                "r1", "https://reddit.com/r/java",
                "b1", "https://blog.net/");

        ReferrerAnalyticsResult result = attribution.attribute(bySession, firstReferrers, 2, null);

        assertTrue(result.group("reddit.com").isEmpty());
        assertThat(result.getReferrerAnalytics())
                .extracting(ReferrerGroup::getReferrer)
                .containsExactly("google.com", "blog.net", "direct");
    }

    @Test
    void noSessionsYieldsNoGroups() {
        ReferrerAnalyticsResult result = attribution.attribute(Map.of(), Map.of(), 3, null);

        assertThat(result.getReferrerAnalytics()).isEmpty();
    }

    private static SessionStepOccurrence row(String session, int step, long seconds, String referrer) {
        return new SessionStepOccurrence(session, step, T0.plusSeconds(seconds), referrer);
    }
}
