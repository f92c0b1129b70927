package com.analytics.funnel.application.port.in;

import java.util.Map;

import com.analytics.funnel.domain.analytics.FunnelAnalyticsResult;
import com.analytics.funnel.domain.analytics.GoalAnalyticsResult;
import com.analytics.funnel.domain.analytics.ReferrerAnalyticsResult;

/**
 * Primary (inbound) port: point-in-time funnel and goal analyses.
 * <p>
 * Every call reads immutable historical events and computes its result from
 * scratch. Failures abort the whole call:
 * </p>
 * <ul>
 * <li>unknown definition → {@code DefinitionNotFoundException}</li>
 * <li>event store failure → {@code AnalyticsQueryException}</li>
 * <li>malformed dates → {@code IllegalArgumentException}</li>
 * </ul>
 */
public interface AnalyzeFunnelUseCase {

    /**
     * Computes strict-order step reach, conversion and dropoff of a funnel.
     *
     * @param request website, funnel id and date range
     * @return funnel analytics
     */
    FunnelAnalyticsResult analyzeFunnel(AnalysisRequest request);

    /**
     * Computes funnel conversion per canonical first referrer.
     *
     * @param request website, funnel id, date range and site domain
     * @return referrer groups sorted by total users descending
     */
    ReferrerAnalyticsResult analyzeFunnelByReferrer(AnalysisRequest request);

    /**
     * Computes completions of a goal and its conversion against all website
     * sessions.
     *
     * @param request website, goal id and date range
     * @return goal analytics
     */
    GoalAnalyticsResult analyzeGoal(AnalysisRequest request);

    /**
     * Analyzes several goals; ids that do not exist are skipped.
     *
     * @param request website, goal ids and date range
     * @return goal id → analytics, in store order
     */
    Map<String, GoalAnalyticsResult> analyzeGoals(BulkGoalRequest request);
}
