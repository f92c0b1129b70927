package com.analytics.funnel.application.port.out;

import java.util.List;
import java.util.Map;

import com.analytics.funnel.domain.entity.SessionStepOccurrence;
import com.analytics.funnel.domain.valueobject.CompiledFilter;
import com.analytics.funnel.domain.valueobject.EventScope;
import com.analytics.funnel.domain.valueobject.StepPredicate;

/**
 * Secondary (outbound) port: read access to the session event log.
 * <p>
 * Every query is restricted to exactly one website and an inclusive time
 * window. Filter values must be bound as query parameters, never
 * concatenated into query text. Implementations propagate failures as
 * unchecked exceptions; callers never receive partial results.
 * </p>
 */
public interface EventLogStore {

    /**
     * Finds, for every session with at least one event matching the filter and
     * the step predicate, the earliest matching timestamp.
     *
     * @param scope           tenant and time window
     * @param filter          compiled definition filters (AND)
     * @param predicate       step match predicate
     * @param stepNumber      step number stamped on the returned rows
     * @param includeReferrer whether to return the referrer of the earliest row
     * @return one row per matching session
     */
    List<SessionStepOccurrence> findFirstOccurrences(EventScope scope, CompiledFilter filter,
            StepPredicate predicate, int stepNumber, boolean includeReferrer);

    /**
     * Finds the earliest non-empty referrer of every session across all of its
     * events matching the filter. Only sessions with at least one event
     * matching both the filter and {@code entryStep} are returned.
     *
     * @param scope     tenant and time window
     * @param filter    compiled definition filters (AND)
     * @param entryStep predicate of the funnel's first step
     * @return session id → first referrer; sessions without a referrer are absent
     */
    Map<String, String> findFirstReferrers(EventScope scope, CompiledFilter filter, StepPredicate entryStep);

    /**
     * Counts distinct sessions with at least one event of the given name.
     *
     * @param scope     tenant and time window
     * @param eventName event name, e.g. the page-view event
     * @return distinct session count
     */
    long countSessions(EventScope scope, String eventName);
}
