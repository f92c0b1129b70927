package com.analytics.funnel.application.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import com.analytics.funnel.domain.entity.Filter;
import com.analytics.funnel.domain.valueobject.CompiledFilter;
import com.analytics.funnel.domain.valueobject.FilterCondition;
import com.analytics.funnel.domain.valueobject.FilterField;
import com.analytics.funnel.domain.valueobject.FilterOperator;

/**
 * Compiles declarative definition filters into a conjunctive predicate.
 * <p>
 * A filter is dropped, never rejected, when its field is not allow-listed,
 * its operator is not supported, or its value does not fit the operator. The
 * remaining filters are combined with AND semantics.
 * </p>
 *
 * <p>
 * <b>Thread-safe:</b> This service has no mutable state.
 * </p>
 */
public class FilterCompiler {

    /**
     * @param filters definition filters, may be null
     * @return compiled filter; a tautology when nothing survives validation
     */
    public CompiledFilter compile(List<Filter> filters) {
        if (filters == null || filters.isEmpty()) {
            return CompiledFilter.matchAll();
        }

        List<FilterCondition> conditions = new ArrayList<>();
        List<Filter> dropped = new ArrayList<>();

        for (Filter filter : filters) {
            if (filter == null) {
                continue;
            }
            Optional<FilterCondition> condition = toCondition(filter);
            if (condition.isPresent()) {
                conditions.add(condition.get());
            } else {
                dropped.add(filter);
            }
        }
        return new CompiledFilter(conditions, dropped);
    }

    private Optional<FilterCondition> toCondition(Filter filter) {
        Optional<FilterField> field = FilterField.fromKey(filter.getField());
        Optional<FilterOperator> operator = FilterOperator.fromKey(filter.getOperator());
        if (field.isEmpty() || operator.isEmpty()) {
            return Optional.empty();
        }

        List<String> values = literalValues(filter.getValues());
        if (values.isEmpty()) {
            return Optional.empty();
        }
        if (!operator.get().isSetOperator() && values.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(new FilterCondition(field.get(), operator.get(), values));
    }

    // Null and empty strings carry no constraint; duplicates are collapsed.
    private List<String> literalValues(List<String> raw) {
        LinkedHashSet<String> values = new LinkedHashSet<>();
        for (String value : raw) {
            if (value != null && !value.isEmpty()) {
                values.add(value);
            }
        }
        return new ArrayList<>(values);
    }
}
