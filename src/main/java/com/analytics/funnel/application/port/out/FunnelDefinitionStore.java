package com.analytics.funnel.application.port.out;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.analytics.funnel.domain.entity.FunnelDefinition;

/**
 * Secondary (outbound) port: read-only access to funnel and goal definitions.
 * <p>
 * Deleted definitions are never returned. Lookups are always scoped to the
 * owning website.
 * </p>
 */
public interface FunnelDefinitionStore {

    /**
     * @param websiteId owning website
     * @param funnelId  funnel identifier
     * @return the funnel, or empty if it does not exist for the website
     */
    Optional<FunnelDefinition> findFunnel(String websiteId, String funnelId);

    /**
     * @param websiteId owning website
     * @param goalId    goal identifier
     * @return the goal, or empty if it does not exist for the website
     */
    Optional<FunnelDefinition> findGoal(String websiteId, String goalId);

    /**
     * Finds the goals of a website among the given ids, newest first.
     *
     * @param websiteId owning website
     * @param goalIds   goal identifiers
     * @return goals found; unknown ids are omitted
     */
    List<FunnelDefinition> findGoals(String websiteId, Collection<String> goalIds);
}
