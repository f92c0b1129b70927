package com.analytics.funnel.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.analytics.funnel.application.port.in.AnalysisRequest;
import com.analytics.funnel.application.port.in.AnalyzeFunnelUseCase;
import com.analytics.funnel.application.port.in.BulkGoalRequest;
import com.analytics.funnel.application.port.out.AnalysisObserver;
import com.analytics.funnel.application.port.out.EventLogStore;
import com.analytics.funnel.application.port.out.FunnelDefinitionStore;
import com.analytics.funnel.domain.analytics.FunnelAnalyticsResult;
import com.analytics.funnel.domain.analytics.GoalAnalyticsResult;
import com.analytics.funnel.domain.analytics.ReferrerAnalyticsResult;
import com.analytics.funnel.domain.analytics.StepProgression;
import com.analytics.funnel.domain.entity.FunnelDefinition;
import com.analytics.funnel.domain.entity.SessionStepOccurrence;
import com.analytics.funnel.domain.exception.DefinitionNotFoundException;
import com.analytics.funnel.domain.valueobject.CompiledFilter;
import com.analytics.funnel.domain.valueobject.DateRange;
import com.analytics.funnel.domain.valueobject.DefinitionKind;
import com.analytics.funnel.domain.valueobject.EventScope;

/**
 * Core use-case implementation: funnel and goal analytics.
 * <p>
 * Pipeline of one analysis:
 * <ol>
 * <li><b>Resolve</b>: load the definition, resolve the date range</li>
 * <li><b>Compile</b>: validate filters, report the dropped ones</li>
 * <li><b>Match</b>: query first occurrences of every step in parallel</li>
 * <li><b>Progress</b>: run the strict-order automaton per session</li>
 * <li><b>Aggregate</b>: derive rates, or attribute them to referrers</li>
 * </ol>
 * </p>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>Unknown definition → {@link DefinitionNotFoundException}, no retry</li>
 * <li>Store errors → {@code AnalyticsQueryException}, no partial result</li>
 * <li>Every failure is reported to the {@link AnalysisObserver} and rethrown</li>
 * </ul>
 */
public class FunnelAnalyticsService implements AnalyzeFunnelUseCase {

    private static final Logger log = LoggerFactory.getLogger(FunnelAnalyticsService.class);

    static final String OP_FUNNEL = "funnel";
    static final String OP_FUNNEL_BY_REFERRER = "funnel_by_referrer";
    static final String OP_GOAL = "goal";

    private final FunnelDefinitionStore definitionStore;
    private final EventLogStore eventLogStore;
    private final FilterCompiler filterCompiler;
    private final StepMatcher stepMatcher;
    private final FunnelProgressionEngine progressionEngine;
    private final MetricsAggregator metricsAggregator;
    private final ReferrerAttribution referrerAttribution;
    private final AnalysisObserver observer;
    private final Clock clock;
    private final int defaultRangeDays;
    private final String pageViewEventName;

    /**
     * All collaborators are injected; none may be null.
     */
    public FunnelAnalyticsService(FunnelDefinitionStore definitionStore,
            EventLogStore eventLogStore,
            FilterCompiler filterCompiler,
            StepMatcher stepMatcher,
            FunnelProgressionEngine progressionEngine,
            MetricsAggregator metricsAggregator,
            ReferrerAttribution referrerAttribution,
            AnalysisObserver observer,
            Clock clock,
            int defaultRangeDays,
            String pageViewEventName) {
        if (definitionStore == null)
            throw new IllegalArgumentException("definitionStore cannot be null");
        if (eventLogStore == null)
            throw new IllegalArgumentException("eventLogStore cannot be null");
        if (filterCompiler == null)
            throw new IllegalArgumentException("filterCompiler cannot be null");
        if (stepMatcher == null)
            throw new IllegalArgumentException("stepMatcher cannot be null");
        if (progressionEngine == null)
            throw new IllegalArgumentException("progressionEngine cannot be null");
        if (metricsAggregator == null)
            throw new IllegalArgumentException("metricsAggregator cannot be null");
        if (referrerAttribution == null)
            throw new IllegalArgumentException("referrerAttribution cannot be null");
        if (observer == null)
            throw new IllegalArgumentException("observer cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (defaultRangeDays < 0)
            throw new IllegalArgumentException("defaultRangeDays cannot be negative");
        if (pageViewEventName == null || pageViewEventName.isBlank())
            throw new IllegalArgumentException("pageViewEventName cannot be null or blank");

        this.definitionStore = definitionStore;
        this.eventLogStore = eventLogStore;
        this.filterCompiler = filterCompiler;
        this.stepMatcher = stepMatcher;
        this.progressionEngine = progressionEngine;
        this.metricsAggregator = metricsAggregator;
        this.referrerAttribution = referrerAttribution;
        this.observer = observer;
        this.clock = clock;
        this.defaultRangeDays = defaultRangeDays;
        this.pageViewEventName = pageViewEventName;
    }

    @Override
    public FunnelAnalyticsResult analyzeFunnel(AnalysisRequest request) {
        FunnelDefinition funnel = definitionStore.findFunnel(request.getWebsiteId(), request.getDefinitionId())
                .orElseThrow(() -> new DefinitionNotFoundException(
                        DefinitionKind.FUNNEL, request.getWebsiteId(), request.getDefinitionId()));
        EventScope scope = resolveScope(funnel, requestedRange(request.getStartDate(), request.getEndDate()));

        return observed(OP_FUNNEL, funnel, scope, () -> computeFunnel(funnel, scope));
    }

    @Override
    public ReferrerAnalyticsResult analyzeFunnelByReferrer(AnalysisRequest request) {
        FunnelDefinition funnel = definitionStore.findFunnel(request.getWebsiteId(), request.getDefinitionId())
                .orElseThrow(() -> new DefinitionNotFoundException(
                        DefinitionKind.FUNNEL, request.getWebsiteId(), request.getDefinitionId()));
        EventScope scope = resolveScope(funnel, requestedRange(request.getStartDate(), request.getEndDate()));

        return observed(OP_FUNNEL_BY_REFERRER, funnel, scope, () -> {
            CompiledFilter filter = compileFilters(funnel);
            List<SessionStepOccurrence> rows = findOccurrences(scope, filter, funnel, true);
            Map<String, List<SessionStepOccurrence>> bySession = progressionEngine.groupBySession(rows);
            Map<String, String> firstReferrers = bySession.isEmpty()
                    ? Map.of()
                    : eventLogStore.findFirstReferrers(scope, filter,
                            stepMatcher.predicateFor(funnel.step(1)));
            return referrerAttribution.attribute(bySession, firstReferrers, funnel.stepCount(),
                    request.getWebsiteDomain());
        });
    }

    @Override
    public GoalAnalyticsResult analyzeGoal(AnalysisRequest request) {
        FunnelDefinition goal = definitionStore.findGoal(request.getWebsiteId(), request.getDefinitionId())
                .orElseThrow(() -> new DefinitionNotFoundException(
                        DefinitionKind.GOAL, request.getWebsiteId(), request.getDefinitionId()));
        EventScope scope = resolveScope(goal, requestedRange(request.getStartDate(), request.getEndDate()));

        return observed(OP_GOAL, goal, scope, () -> computeGoal(goal, scope));
    }

    @Override
    public Map<String, GoalAnalyticsResult> analyzeGoals(BulkGoalRequest request) {
        DateRange range = requestedRange(request.getStartDate(), request.getEndDate());
        List<FunnelDefinition> goals = definitionStore.findGoals(request.getWebsiteId(), request.getGoalIds());

        Set<String> missing = new LinkedHashSet<>(request.getGoalIds());
        Map<String, GoalAnalyticsResult> results = new LinkedHashMap<>();
        for (FunnelDefinition goal : goals) {
            missing.remove(goal.getId());
            EventScope scope = resolveScope(goal, range);
            results.put(goal.getId(), observed(OP_GOAL, goal, scope, () -> computeGoal(goal, scope)));
        }

        if (!missing.isEmpty()) {
            log.warn("action=goals_not_found websiteId={} goalIds={}", request.getWebsiteId(), missing);
        }
        return results;
    }

    // ─────────────────── Pipelines ───────────────────

    private FunnelAnalyticsResult computeFunnel(FunnelDefinition definition, EventScope scope) {
        CompiledFilter filter = compileFilters(definition);
        List<SessionStepOccurrence> rows = findOccurrences(scope, filter, definition, false);
        Map<String, List<SessionStepOccurrence>> bySession = progressionEngine.groupBySession(rows);
        StepProgression progression = progressionEngine.progress(bySession, definition.stepCount());

        log.debug("action=progression_complete definitionId={} sessions={} progression={}",
                definition.getId(), bySession.size(), progression);
        return metricsAggregator.aggregate(progression, definition.getSteps());
    }

    private GoalAnalyticsResult computeGoal(FunnelDefinition goal, EventScope scope) {
        FunnelAnalyticsResult analytics = computeFunnel(goal, scope);
        long websiteUsers = scope.isEmpty() ? 0 : eventLogStore.countSessions(scope, pageViewEventName);
        double websiteConversion = metricsAggregator.percentage(analytics.getTotalUsersCompleted(), websiteUsers);
        return new GoalAnalyticsResult(goal.getId(), analytics, websiteUsers, websiteConversion);
    }

    // ─────────────────── Private Helpers ───────────────────

    private CompiledFilter compileFilters(FunnelDefinition definition) {
        CompiledFilter filter = filterCompiler.compile(definition.getFilters());
        if (filter.hasDropped()) {
            observer.filtersDropped(definition, filter.getDropped());
        }
        return filter;
    }

    /**
     * An empty scope matches nothing, so the store is not asked.
     */
    private List<SessionStepOccurrence> findOccurrences(EventScope scope, CompiledFilter filter,
            FunnelDefinition definition, boolean includeReferrer) {
        if (scope.isEmpty()) {
            log.debug("action=empty_scope definitionId={} scope={}", definition.getId(), scope);
            return List.of();
        }
        return stepMatcher.findOccurrences(scope, filter, definition.getSteps(), includeReferrer);
    }

    private DateRange requestedRange(String startDate, String endDate) {
        return DateRange.resolve(startDate, endDate, clock, defaultRangeDays);
    }

    /**
     * Applies the definition's "ignore historic data" flag: the range never
     * starts before the day the definition was created. A definition created
     * after the requested end date yields an empty scope.
     */
    private EventScope resolveScope(FunnelDefinition definition, DateRange requested) {
        DateRange range = requested;
        if (definition.isIgnoreHistoricData() && definition.getCreatedAt() != null) {
            range = requested.clampStart(LocalDate.ofInstant(definition.getCreatedAt(), clock.getZone()));
        }
        return EventScope.of(definition.getWebsiteId(), range);
    }

    private <T> T observed(String operation, FunnelDefinition definition, EventScope scope, Supplier<T> analysis) {
        Instant startTime = clock.instant();
        MDC.put("websiteId", definition.getWebsiteId());
        MDC.put("definitionId", definition.getId());
        MDC.put("operation", operation);
        try {
            observer.analysisStarted(operation, definition, scope);
            T result = analysis.get();
            observer.analysisCompleted(operation, definition, Duration.between(startTime, clock.instant()));
            return result;
        } catch (RuntimeException e) {
            observer.analysisFailed(operation, definition, e);
            throw e;
        } finally {
            MDC.remove("websiteId");
            MDC.remove("definitionId");
            MDC.remove("operation");
        }
    }
}
