package com.analytics.funnel.adapters.out.postgres;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import com.analytics.funnel.application.port.out.FunnelDefinitionStore;
import com.analytics.funnel.domain.entity.Filter;
import com.analytics.funnel.domain.entity.FunnelDefinition;
import com.analytics.funnel.domain.entity.FunnelStep;
import com.analytics.funnel.domain.exception.AnalyticsQueryException;
import com.analytics.funnel.domain.valueobject.DefinitionKind;
import com.analytics.funnel.domain.valueobject.StepType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * PostgreSQL implementation of the FunnelDefinitionStore outbound port.
 * <p>
 * Definitions live in {@code funnel_definitions}; steps and filters are JSON
 * documents mapped with Jackson. Soft-deleted rows ({@code deleted_at} set)
 * are invisible.
 * </p>
 */
@Component
public class PostgresFunnelDefinitionStore implements FunnelDefinitionStore {

    private static final Logger log = LoggerFactory.getLogger(PostgresFunnelDefinitionStore.class);

    private static final String SELECT_COLUMNS = "SELECT id, website_id, kind, name, steps, filters, "
            + "ignore_historic_data, created_at FROM funnel_definitions ";

    private static final String SELECT_ONE_SQL = SELECT_COLUMNS
            + "WHERE id = :id AND website_id = :websiteId AND kind = :kind AND deleted_at IS NULL";

    private static final String SELECT_MANY_SQL = SELECT_COLUMNS
            + "WHERE id IN (:ids) AND website_id = :websiteId AND kind = :kind AND deleted_at IS NULL "
            + "ORDER BY created_at DESC";

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PostgresFunnelDefinitionStore(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<FunnelDefinition> findFunnel(String websiteId, String funnelId) {
        return findOne(websiteId, funnelId, DefinitionKind.FUNNEL);
    }

    @Override
    public Optional<FunnelDefinition> findGoal(String websiteId, String goalId) {
        return findOne(websiteId, goalId, DefinitionKind.GOAL);
    }

    @Override
    public List<FunnelDefinition> findGoals(String websiteId, Collection<String> goalIds) {
        if (goalIds == null || goalIds.isEmpty()) {
            return Collections.emptyList();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ids", new ArrayList<>(goalIds))
                .addValue("websiteId", websiteId)
                .addValue("kind", DefinitionKind.GOAL.name());
        try {
            return jdbcTemplate.query(SELECT_MANY_SQL, params, (rs, rowNum) -> mapRowToDefinition(rs));
        } catch (DataAccessException e) {
            log.error("action=goals_query_error websiteId={} error={}", websiteId, e.getMessage());
            throw new AnalyticsQueryException("Failed to load goals for website " + websiteId, e);
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    private Optional<FunnelDefinition> findOne(String websiteId, String id, DefinitionKind kind) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("websiteId", websiteId)
                .addValue("kind", kind.name());
        try {
            List<FunnelDefinition> rows = jdbcTemplate.query(SELECT_ONE_SQL, params,
                    (rs, rowNum) -> mapRowToDefinition(rs));
            if (rows.isEmpty()) {
                log.debug("action=definition_not_found websiteId={} id={} kind={}", websiteId, id, kind);
                return Optional.empty();
            }
            return Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            log.error("action=definition_query_error websiteId={} id={} error={}", websiteId, id, e.getMessage());
            throw new AnalyticsQueryException("Failed to load definition " + id, e);
        }
    }

    private FunnelDefinition mapRowToDefinition(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        Timestamp createdAt = rs.getTimestamp("created_at");

        return new FunnelDefinition(
                id,
                rs.getString("website_id"),
                rs.getString("name"),
                DefinitionKind.valueOf(rs.getString("kind")),
                parseSteps(id, rs.getString("steps")),
                parseFilters(id, rs.getString("filters")),
                createdAt != null ? createdAt.toInstant() : null,
                rs.getBoolean("ignore_historic_data"));
    }

    private List<FunnelStep> parseSteps(String definitionId, String json) {
        try {
            List<StepDto> dtos = objectMapper.readValue(json, new TypeReference<List<StepDto>>() {
            });
            List<FunnelStep> steps = new ArrayList<>(dtos.size());
            for (StepDto dto : dtos) {
                steps.add(dto.toDomain());
            }
            return steps;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("action=steps_parse_error definitionId={} error={}", definitionId, e.getMessage());
            throw new AnalyticsQueryException("Malformed steps in definition " + definitionId, e);
        }
    }

    private List<Filter> parseFilters(String definitionId, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<FilterDto> dtos = objectMapper.readValue(json, new TypeReference<List<FilterDto>>() {
            });
            List<Filter> filters = new ArrayList<>(dtos.size());
            for (FilterDto dto : dtos) {
                filters.add(dto.toDomain());
            }
            return filters;
        } catch (JsonProcessingException e) {
            log.error("action=filters_parse_error definitionId={} error={}", definitionId, e.getMessage());
            throw new AnalyticsQueryException("Malformed filters in definition " + definitionId, e);
        }
    }

    // ─────────────────── Inner DTO Classes ───────────────────

    /**
     * Serialization DTO of one stored step.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StepDto {

        @JsonProperty("step_number")
        private int stepNumber;

        @JsonProperty("type")
        private String type;

        @JsonProperty("target")
        private String target;

        @JsonProperty("name")
        private String name;

        public StepDto() {
        } // Jackson

        public FunnelStep toDomain() {
            return new FunnelStep(stepNumber, StepType.parse(type), target, name);
        }

        public int getStepNumber() {
            return stepNumber;
        }

        public void setStepNumber(int stepNumber) {
            this.stepNumber = stepNumber;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    /**
     * Serialization DTO of one stored filter. {@code value} is either a string
     * or an array of strings.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FilterDto {

        @JsonProperty("field")
        private String field;

        @JsonProperty("operator")
        private String operator;

        @JsonProperty("value")
        private JsonNode value;

        public FilterDto() {
        } // Jackson

        public Filter toDomain() {
            List<String> values = new ArrayList<>();
            if (value != null && value.isArray()) {
                value.forEach(node -> values.add(node.isNull() ? null : node.asText()));
            } else if (value != null && !value.isNull()) {
                values.add(value.asText());
            }
            return Filter.of(field, operator, values);
        }

        public String getField() {
            return field;
        }

        public void setField(String field) {
            this.field = field;
        }

        public String getOperator() {
            return operator;
        }

        public void setOperator(String operator) {
            this.operator = operator;
        }

        public JsonNode getValue() {
            return value;
        }

        public void setValue(JsonNode value) {
            this.value = value;
        }
    }
}
