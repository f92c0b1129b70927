package com.analytics.funnel.adapters.out.postgres;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import com.analytics.funnel.domain.entity.SessionStepOccurrence;
import com.analytics.funnel.domain.exception.AnalyticsQueryException;
import com.analytics.funnel.domain.valueobject.CompiledFilter;
import com.analytics.funnel.domain.valueobject.EventScope;
import com.analytics.funnel.domain.valueobject.FilterCondition;
import com.analytics.funnel.domain.valueobject.FilterField;
import com.analytics.funnel.domain.valueobject.FilterOperator;
import com.analytics.funnel.domain.valueobject.StepPredicate;

class PostgresEventLogStoreTest {

    private static final String SITE = "site-1";
    private static final EventScope MARCH = new EventScope(SITE,
            LocalDateTime.of(2024, 3, 1, 0, 0), LocalDateTime.of(2024, 3, 31, 23, 59, 59));
    private static final StepPredicate PRICING_VIEW = StepPredicate.pageView("screen_view", "/pricing");

    private EmbeddedDatabase database;
    private NamedParameterJdbcTemplate jdbcTemplate;
    private PostgresEventLogStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .setName("events-" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE")
                .addScript("classpath:schema.sql")
                .build();
        jdbcTemplate = new NamedParameterJdbcTemplate(database);
        store = new PostgresEventLogStore(jdbcTemplate);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void firstOccurrenceIsEarliestMatchingEventPerSession() {
        insert("s1", "screen_view", "/pricing", null, at(2, 10, 5), "DE");
        insert("s1", "screen_view", "/pricing", null, at(2, 10, 0), "DE");
        insert("s2", "screen_view", "/pricing?plan=pro", null, at(3, 11, 0), "FR");
        insert("s3", "screen_view", "/about", null, at(3, 12, 0), "DE");
        insert("s4", "click", "/pricing", null, at(3, 12, 0), "DE");

        Map<String, SessionStepOccurrence> rows = bySession(
                store.findFirstOccurrences(MARCH, CompiledFilter.matchAll(), PRICING_VIEW, 2, false));

        assertThat(rows).containsOnlyKeys("s1", "s2");
        assertEquals(instant(at(2, 10, 0)), rows.get("s1").getFirstOccurrence());
        assertEquals(2, rows.get("s1").getStepNumber());
        assertThat(rows.get("s1").getReferrer()).isEmpty();
    }

    @Test
    void eventsOutsideScopeAreIgnored() {
        insert("s1", "signup", null, null, LocalDateTime.of(2024, 2, 29, 23, 59, 59), null);
        insert("s2", "signup", null, null, LocalDateTime.of(2024, 3, 31, 23, 59, 59), null);
        insert("s3", "signup", null, null, LocalDateTime.of(2024, 4, 1, 0, 0), null);
        jdbcTemplate.update("INSERT INTO events (website_id, session_id, event_name, event_time) "
                + "VALUES ('site-2', 's4', 'signup', :t)",
                new MapSqlParameterSource("t", Timestamp.valueOf(at(5, 9, 0))));

        List<SessionStepOccurrence> rows = store.findFirstOccurrences(MARCH, CompiledFilter.matchAll(),
                StepPredicate.eventNamed("signup"), 1, false);

        assertThat(rows).extracting(SessionStepOccurrence::getSessionId).containsExactly("s2");
    }

    @Test
    void referrerComesFromEarliestMatchingEvent() {
        insert("s1", "screen_view", "/pricing", "https://bing.com/", at(4, 9, 30), null);
        insert("s1", "screen_view", "/pricing", "https://google.com/", at(4, 9, 0), null);

        List<SessionStepOccurrence> rows = store.findFirstOccurrences(MARCH, CompiledFilter.matchAll(),
                PRICING_VIEW, 1, true);

        assertEquals(1, rows.size());
        assertEquals("https://google.com/", rows.get(0).getReferrer().orElseThrow());
        assertEquals(instant(at(4, 9, 0)), rows.get(0).getFirstOccurrence());
    }

    @Test
    void filtersAreConjunctive() {
        insert("de", "signup", null, null, at(5, 9, 0), "DE");
        insert("fr", "signup", null, null, at(5, 9, 0), "FR");
        insert("us", "signup", null, null, at(5, 9, 0), "US");

        CompiledFilter notFrenchOrAmerican = filter(FilterField.COUNTRY, FilterOperator.NOT_IN, "FR", "US");
        CompiledFilter europe = filter(FilterField.COUNTRY, FilterOperator.IN, "DE", "FR");
        CompiledFilter notGerman = filter(FilterField.COUNTRY, FilterOperator.NOT_EQUALS, "DE");
        CompiledFilter both = new CompiledFilter(List.of(
                new FilterCondition(FilterField.COUNTRY, FilterOperator.IN, List.of("DE", "FR")),
                new FilterCondition(FilterField.COUNTRY, FilterOperator.NOT_EQUALS, List.of("DE"))), List.of());

        assertThat(sessions(notFrenchOrAmerican)).containsExactly("de");
        assertThat(sessions(europe)).containsExactlyInAnyOrder("de", "fr");
        assertThat(sessions(notGerman)).containsExactlyInAnyOrder("fr", "us");
        assertThat(sessions(both)).containsExactly("fr");
    }

    @Test
    void containsTreatsWildcardsLiterally() {
        insert("pct", "signup", "/sale-50%", null, at(6, 9, 0), null);
        insert("num", "signup", "/sale-500", null, at(6, 9, 0), null);
        insert("und", "signup", "/a_b", null, at(6, 9, 0), null);
        insert("any", "signup", "/axb", null, at(6, 9, 0), null);

        assertThat(sessions(filter(FilterField.PATH, FilterOperator.CONTAINS, "50%"))).containsExactly("pct");
        assertThat(sessions(filter(FilterField.PATH, FilterOperator.CONTAINS, "a_b"))).containsExactly("und");
    }

    @Test
    void firstReferrerSkipsEventsWithoutReferrer() {
        insert("s1", "screen_view", "/", null, at(7, 8, 0), null);
        insert("s1", "screen_view", "/", "", at(7, 8, 1), null);
        insert("s1", "screen_view", "/", "https://news.ycombinator.com/", at(7, 8, 2), null);
        insert("s1", "screen_view", "/", "https://google.com/", at(7, 8, 3), null);
        insert("s2", "screen_view", "/", null, at(7, 8, 0), null);

        Map<String, String> referrers = store.findFirstReferrers(MARCH, CompiledFilter.matchAll(),
                StepPredicate.pageView("screen_view", "/"));

        assertEquals(Map.of("s1", "https://news.ycombinator.com/"), referrers);
    }

    @Test
    void firstReferrerIsOnlyLoadedForSessionsEnteringTheFunnel() {
        insert("s1", "screen_view", "/blog", "https://google.com/", at(9, 8, 0), "DE");
        insert("s1", "screen_view", "/pricing", null, at(9, 8, 5), "DE");
        insert("s2", "screen_view", "/blog", "https://t.co/abc", at(9, 9, 0), "DE");
        insert("s3", "screen_view", "/pricing", "https://bing.com/", at(9, 10, 0), "FR");

        Map<String, String> referrers = store.findFirstReferrers(MARCH,
                filter(FilterField.COUNTRY, FilterOperator.NOT_EQUALS, "FR"), PRICING_VIEW);

        assertEquals(Map.of("s1", "https://google.com/"), referrers);
    }

    @Test
    void countSessionsCountsDistinctSessions() {
        insert("s1", "screen_view", "/", null, at(8, 8, 0), null);
        insert("s1", "screen_view", "/a", null, at(8, 8, 5), null);
        insert("s2", "screen_view", "/", null, at(8, 9, 0), null);
        insert("s3", "signup", null, null, at(8, 9, 0), null);

        assertEquals(2, store.countSessions(MARCH, "screen_view"));
        assertEquals(0, store.countSessions(MARCH, "purchase"));
    }

    @Test
    void databaseErrorsAreTranslated() {
        jdbcTemplate.getJdbcTemplate().execute("DROP TABLE events");

        assertThrows(AnalyticsQueryException.class, () -> store.findFirstOccurrences(MARCH,
                CompiledFilter.matchAll(), PRICING_VIEW, 1, false));
        assertThrows(AnalyticsQueryException.class, () -> store.countSessions(MARCH, "screen_view"));
    }

    @Test
    void escapeLikeEscapesWildcardsAndEscapeCharacter() {
        assertEquals("50\\%\\_off\\\\", PostgresEventLogStore.escapeLike("50%_off\\"));
    }

    // ─────────────────── Helpers ───────────────────

    private List<String> sessions(CompiledFilter filter) {
        return store.findFirstOccurrences(MARCH, filter, StepPredicate.eventNamed("signup"), 1, false).stream()
                .map(SessionStepOccurrence::getSessionId)
                .collect(Collectors.toList());
    }

    private static CompiledFilter filter(FilterField field, FilterOperator operator, String... values) {
        return new CompiledFilter(List.of(new FilterCondition(field, operator, List.of(values))), List.of());
    }

    private void insert(String session, String eventName, String path, String referrer,
            LocalDateTime time, String country) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("websiteId", SITE)
                .addValue("sessionId", session)
                .addValue("eventName", eventName)
                .addValue("path", path)
                .addValue("referrer", referrer)
                .addValue("eventTime", Timestamp.valueOf(time))
                .addValue("country", country);
        jdbcTemplate.update("INSERT INTO events (website_id, session_id, event_name, path, referrer, event_time, country) "
                + "VALUES (:websiteId, :sessionId, :eventName, :path, :referrer, :eventTime, :country)", params);
    }

    private static Map<String, SessionStepOccurrence> bySession(List<SessionStepOccurrence> rows) {
        return rows.stream().collect(Collectors.toMap(SessionStepOccurrence::getSessionId, row -> row));
    }

    private static LocalDateTime at(int day, int hour, int minute) {
        return LocalDateTime.of(2024, 3, day, hour, minute);
    }

    private static Instant instant(LocalDateTime time) {
        return Timestamp.valueOf(time).toInstant();
    }
}
