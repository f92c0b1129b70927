package com.analytics.funnel.adapters.out.postgres;

import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import com.analytics.funnel.application.port.out.EventLogStore;
import com.analytics.funnel.domain.entity.SessionStepOccurrence;
import com.analytics.funnel.domain.exception.AnalyticsQueryException;
import com.analytics.funnel.domain.valueobject.CompiledFilter;
import com.analytics.funnel.domain.valueobject.EventScope;
import com.analytics.funnel.domain.valueobject.FilterCondition;
import com.analytics.funnel.domain.valueobject.StepPredicate;

/**
 * PostgreSQL implementation of the EventLogStore outbound port.
 * <p>
 * Reads the {@code events} table. Every literal is bound as a named
 * parameter; only allow-listed column names are written into the SQL text.
 * The first row of a session is picked with {@code ROW_NUMBER()} so that its
 * referrer comes from the same event as its timestamp.
 * </p>
 */
@Component
public class PostgresEventLogStore implements EventLogStore {

    private static final Logger log = LoggerFactory.getLogger(PostgresEventLogStore.class);

    private static final String SCOPE_CONDITION = "website_id = :websiteId "
            + "AND event_time >= :fromTime AND event_time <= :toTime";

    private static final String FIRST_OCCURRENCE_SQL = "SELECT session_id, MIN(event_time) AS first_occurrence "
            + "FROM events WHERE %s GROUP BY session_id";

    private static final String FIRST_OCCURRENCE_WITH_REFERRER_SQL = "SELECT session_id, event_time AS first_occurrence, referrer "
            + "FROM (SELECT session_id, event_time, referrer, "
            + "ROW_NUMBER() OVER (PARTITION BY session_id ORDER BY event_time) AS rn "
            + "FROM events WHERE %s) ranked "
            + "WHERE rn = 1";

    private static final String FIRST_REFERRER_SQL = "SELECT session_id, referrer "
            + "FROM (SELECT session_id, referrer, "
            + "ROW_NUMBER() OVER (PARTITION BY session_id ORDER BY event_time) AS rn "
            + "FROM events WHERE %s AND referrer IS NOT NULL AND referrer <> '' "
            + "AND session_id IN (SELECT session_id FROM events WHERE %s)) ranked "
            + "WHERE rn = 1";

    private static final String COUNT_SESSIONS_SQL = "SELECT COUNT(DISTINCT session_id) FROM events "
            + "WHERE " + SCOPE_CONDITION + " AND event_name = :eventName";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public PostgresEventLogStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<SessionStepOccurrence> findFirstOccurrences(EventScope scope, CompiledFilter filter,
            StepPredicate predicate, int stepNumber, boolean includeReferrer) {
        MapSqlParameterSource params = scopeParams(scope);
        StringBuilder where = new StringBuilder(SCOPE_CONDITION);
        appendStepPredicate(where, params, predicate);
        appendFilter(where, params, filter);

        String sql = String.format(includeReferrer ? FIRST_OCCURRENCE_WITH_REFERRER_SQL : FIRST_OCCURRENCE_SQL, where);
        try {
            List<SessionStepOccurrence> rows = jdbcTemplate.query(sql, params,
                    (rs, rowNum) -> new SessionStepOccurrence(
                            rs.getString("session_id"),
                            stepNumber,
                            rs.getTimestamp("first_occurrence").toInstant(),
                            includeReferrer ? rs.getString("referrer") : null));
            log.debug("action=first_occurrences websiteId={} step={} predicate={} rows={}",
                    scope.getWebsiteId(), stepNumber, predicate, rows.size());
            return rows;
        } catch (DataAccessException e) {
            log.error("action=first_occurrences_error websiteId={} step={} error={}",
                    scope.getWebsiteId(), stepNumber, e.getMessage());
            throw new AnalyticsQueryException("Failed to query step " + stepNumber
                    + " for website " + scope.getWebsiteId(), e);
        }
    }

    @Override
    public Map<String, String> findFirstReferrers(EventScope scope, CompiledFilter filter,
            StepPredicate entryStep) {
        MapSqlParameterSource params = scopeParams(scope);
        StringBuilder where = new StringBuilder(SCOPE_CONDITION);
        appendFilter(where, params, filter);
        // filter parameters are bound once and shared by both clauses
        StringBuilder entered = new StringBuilder(where);
        appendStepPredicate(entered, params, entryStep);

        Map<String, String> referrers = new LinkedHashMap<>();
        try {
            jdbcTemplate.query(String.format(FIRST_REFERRER_SQL, where, entered), params,
                    (RowCallbackHandler) rs -> referrers.put(rs.getString("session_id"), rs.getString("referrer")));
        } catch (DataAccessException e) {
            log.error("action=first_referrers_error websiteId={} error={}", scope.getWebsiteId(), e.getMessage());
            throw new AnalyticsQueryException("Failed to query session referrers for website "
                    + scope.getWebsiteId(), e);
        }
        log.debug("action=first_referrers websiteId={} sessions={}", scope.getWebsiteId(), referrers.size());
        return referrers;
    }

    @Override
    public long countSessions(EventScope scope, String eventName) {
        MapSqlParameterSource params = scopeParams(scope).addValue("eventName", eventName);
        try {
            Long count = jdbcTemplate.queryForObject(COUNT_SESSIONS_SQL, params, Long.class);
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            log.error("action=count_sessions_error websiteId={} error={}", scope.getWebsiteId(), e.getMessage());
            throw new AnalyticsQueryException("Failed to count sessions for website " + scope.getWebsiteId(), e);
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    private MapSqlParameterSource scopeParams(EventScope scope) {
        return new MapSqlParameterSource()
                .addValue("websiteId", scope.getWebsiteId())
                .addValue("fromTime", Timestamp.valueOf(scope.getFrom()))
                .addValue("toTime", Timestamp.valueOf(scope.getTo()));
    }

    private void appendStepPredicate(StringBuilder where, MapSqlParameterSource params, StepPredicate predicate) {
        where.append(" AND event_name = :stepEventName");
        params.addValue("stepEventName", predicate.getEventName());

        predicate.getPathTarget().ifPresent(target -> {
            where.append(" AND (path = :stepPath OR path LIKE :stepPathLike ESCAPE '\\')");
            params.addValue("stepPath", target);
            params.addValue("stepPathLike", "%" + escapeLike(target) + "%");
        });
    }

    private void appendFilter(StringBuilder where, MapSqlParameterSource params, CompiledFilter filter) {
        List<FilterCondition> conditions = filter.getConditions();
        for (int i = 0; i < conditions.size(); i++) {
            FilterCondition condition = conditions.get(i);
            String column = condition.getField().getColumn();
            String param = "f" + i;

            switch (condition.getOperator()) {
                case EQUALS -> {
                    where.append(" AND ").append(column).append(" = :").append(param);
                    params.addValue(param, condition.getValue());
                }
                case NOT_EQUALS -> {
                    where.append(" AND ").append(column).append(" <> :").append(param);
                    params.addValue(param, condition.getValue());
                }
                case CONTAINS -> {
                    where.append(" AND ").append(column).append(" LIKE :").append(param).append(" ESCAPE '\\'");
                    params.addValue(param, "%" + escapeLike(condition.getValue()) + "%");
                }
                case IN -> {
                    where.append(" AND ").append(column).append(" IN (:").append(param).append(')');
                    params.addValue(param, condition.getValues());
                }
                case NOT_IN -> {
                    where.append(" AND ").append(column).append(" NOT IN (:").append(param).append(')');
                    params.addValue(param, condition.getValues());
                }
            }
        }
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
