package com.analytics.funnel.domain.valueobject;

import java.util.List;

import com.analytics.funnel.domain.entity.Filter;

/**
 * Conjunction of validated filter conditions.
 * <p>
 * An empty condition list is a tautology. The filters that failed validation
 * are kept for diagnostics only and never reach the event log store.
 * </p>
 */
public final class CompiledFilter {

    private static final CompiledFilter MATCH_ALL = new CompiledFilter(List.of(), List.of());

    private final List<FilterCondition> conditions;
    private final List<Filter> dropped;

    public CompiledFilter(List<FilterCondition> conditions, List<Filter> dropped) {
        this.conditions = conditions != null ? List.copyOf(conditions) : List.of();
        this.dropped = dropped != null ? List.copyOf(dropped) : List.of();
    }

    public static CompiledFilter matchAll() {
        return MATCH_ALL;
    }

    public boolean isTautology() {
        return conditions.isEmpty();
    }

    public boolean hasDropped() {
        return !dropped.isEmpty();
    }

    public List<FilterCondition> getConditions() {
        return conditions;
    }

    public List<Filter> getDropped() {
        return dropped;
    }

    @Override
    public String toString() {
        return "CompiledFilter{conditions=" + conditions + ", dropped=" + dropped.size() + "}";
    }
}
