package com.analytics.funnel.application.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.analytics.funnel.application.port.out.EventLogStore;
import com.analytics.funnel.domain.entity.FunnelStep;
import com.analytics.funnel.domain.entity.SessionStepOccurrence;
import com.analytics.funnel.domain.exception.AnalyticsQueryException;
import com.analytics.funnel.domain.valueobject.CompiledFilter;
import com.analytics.funnel.domain.valueobject.EventScope;
import com.analytics.funnel.domain.valueobject.StepPredicate;

/**
 * Builds per-step match predicates and collects first-occurrence rows.
 * <p>
 * The step queries are independent and are submitted to the injected executor
 * together. All of them must succeed: the first failure cancels the others and
 * aborts with {@link AnalyticsQueryException}.
 * </p>
 */
public class StepMatcher {

    private static final Logger log = LoggerFactory.getLogger(StepMatcher.class);

    private final EventLogStore eventLogStore;
    private final ExecutorService queryExecutor;
    private final String pageViewEventName;

    public StepMatcher(EventLogStore eventLogStore, ExecutorService queryExecutor, String pageViewEventName) {
        if (eventLogStore == null)
            throw new IllegalArgumentException("eventLogStore cannot be null");
        if (queryExecutor == null)
            throw new IllegalArgumentException("queryExecutor cannot be null");
        if (pageViewEventName == null || pageViewEventName.isBlank())
            throw new IllegalArgumentException("pageViewEventName cannot be null or blank");

        this.eventLogStore = eventLogStore;
        this.queryExecutor = queryExecutor;
        this.pageViewEventName = pageViewEventName;
    }

    /**
     * Match predicate of a step. EVENT and CUSTOM steps share the event-name
     * predicate.
     *
     * @param step funnel step
     * @return predicate
     */
    public StepPredicate predicateFor(FunnelStep step) {
        return switch (step.getType()) {
            case PAGE_VIEW -> StepPredicate.pageView(pageViewEventName, step.getTarget());
            case EVENT, CUSTOM -> StepPredicate.eventNamed(step.getTarget());
        };
    }

    /**
     * Queries every step and returns the union of their rows.
     *
     * @param scope           tenant and time window
     * @param filter          compiled definition filters
     * @param steps           funnel steps, in order
     * @param includeReferrer whether rows carry the referrer of the earliest match
     * @return all first-occurrence rows of all steps
     * @throws AnalyticsQueryException if any step query fails
     */
    public List<SessionStepOccurrence> findOccurrences(EventScope scope, CompiledFilter filter,
            List<FunnelStep> steps, boolean includeReferrer) {
        List<Future<List<SessionStepOccurrence>>> futures = new ArrayList<>(steps.size());
        for (FunnelStep step : steps) {
            StepPredicate predicate = predicateFor(step);
            Callable<List<SessionStepOccurrence>> query = () -> eventLogStore.findFirstOccurrences(
                    scope, filter, predicate, step.getIndex(), includeReferrer);
            futures.add(queryExecutor.submit(query));
        }

        List<SessionStepOccurrence> rows = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                List<SessionStepOccurrence> stepRows = futures.get(i).get();
                log.debug("action=step_query_complete websiteId={} step={} sessions={}",
                        scope.getWebsiteId(), steps.get(i).getIndex(), stepRows.size());
                rows.addAll(stepRows);
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AnalyticsQueryException) {
                throw (AnalyticsQueryException) cause;
            }
            throw new AnalyticsQueryException("Step query failed for website " + scope.getWebsiteId(), cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new AnalyticsQueryException("Interrupted while waiting for step queries", e);
        }
        return rows;
    }

    private void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
