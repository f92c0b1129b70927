package com.analytics.funnel.application.port.out;

import java.time.Duration;
import java.util.List;

import com.analytics.funnel.domain.entity.Filter;
import com.analytics.funnel.domain.entity.FunnelDefinition;
import com.analytics.funnel.domain.valueobject.EventScope;

/**
 * Secondary (outbound) port: observability hook of the analysis pipeline.
 * <p>
 * Injected into the services instead of a process-wide logger so that
 * deployments can route analysis traces to logs, metrics or alerts.
 * Implementations must not throw.
 * </p>
 */
public interface AnalysisObserver {

    void analysisStarted(String operation, FunnelDefinition definition, EventScope scope);

    /**
     * Called when filters of a definition were dropped because their field,
     * operator or value is not usable.
     */
    void filtersDropped(FunnelDefinition definition, List<Filter> dropped);

    void analysisCompleted(String operation, FunnelDefinition definition, Duration elapsed);

    void analysisFailed(String operation, FunnelDefinition definition, Exception error);
}
