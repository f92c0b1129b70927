package com.analytics.funnel.adapters.out.logging;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.analytics.funnel.application.port.out.AnalysisObserver;
import com.analytics.funnel.domain.entity.Filter;
import com.analytics.funnel.domain.entity.FunnelDefinition;
import com.analytics.funnel.domain.valueobject.EventScope;

/**
 * SLF4J implementation of the AnalysisObserver outbound port.
 * <p>
 * Emits one structured key=value line per lifecycle event. Dropped filters
 * are logged at WARN since they silently change the numbers a user sees.
 * </p>
 */
@Component
public class Slf4jAnalysisObserver implements AnalysisObserver {

    private static final Logger log = LoggerFactory.getLogger(Slf4jAnalysisObserver.class);

    @Override
    public void analysisStarted(String operation, FunnelDefinition definition, EventScope scope) {
        log.info("action=analysis_start operation={} websiteId={} definitionId={} steps={} from={} to={}",
                operation, definition.getWebsiteId(), definition.getId(), definition.stepCount(),
                scope.getFrom(), scope.getTo());
    }

    @Override
    public void filtersDropped(FunnelDefinition definition, List<Filter> dropped) {
        for (Filter filter : dropped) {
            log.warn("action=filter_dropped websiteId={} definitionId={} field={} operator={} values={}",
                    definition.getWebsiteId(), definition.getId(),
                    filter.getField(), filter.getOperator(), filter.getValues().size());
        }
    }

    @Override
    public void analysisCompleted(String operation, FunnelDefinition definition, Duration elapsed) {
        log.info("action=analysis_complete operation={} websiteId={} definitionId={} latency={}ms",
                operation, definition.getWebsiteId(), definition.getId(), elapsed.toMillis());
    }

    @Override
    public void analysisFailed(String operation, FunnelDefinition definition, Exception error) {
        log.error("action=analysis_error operation={} websiteId={} definitionId={} error={}",
                operation, definition.getWebsiteId(), definition.getId(), error.getMessage(), error);
    }
}
