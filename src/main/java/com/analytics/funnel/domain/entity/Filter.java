package com.analytics.funnel.domain.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declarative filter as written in a funnel or goal definition.
 * <p>
 * A filter is raw input: its field and operator are not validated here. The
 * filter compiler decides whether it is usable; unusable filters are dropped,
 * never rejected.
 * </p>
 */
public final class Filter {

    private final String field;
    private final String operator;
    private final List<String> values;

    /**
     * @param field    attribute key, e.g. "country"
     * @param operator operator key, e.g. "equals"
     * @param values   literal values; a scalar value is a one-element list
     */
    public Filter(String field, String operator, List<String> values) {
        this.field = field;
        this.operator = operator;
        this.values = values != null
                ? Collections.unmodifiableList(new ArrayList<>(values))
                : Collections.emptyList();
    }

    /**
     * Creates a single-value filter.
     */
    public static Filter of(String field, String operator, String value) {
        return new Filter(field, operator, value != null ? List.of(value) : null);
    }

    /**
     * Creates a multi-value filter (for "in" / "not_in").
     */
    public static Filter of(String field, String operator, List<String> values) {
        return new Filter(field, operator, values);
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Filter that = (Filter) o;
        return Objects.equals(field, that.field)
                && Objects.equals(operator, that.operator)
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, values);
    }

    @Override
    public String toString() {
        return "Filter{field='" + field + "', operator='" + operator + "', values=" + values + "}";
    }
}
