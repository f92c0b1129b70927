package com.analytics.funnel.domain.valueobject;

import java.util.List;
import java.util.Objects;

/**
 * A validated filter: allow-listed field, supported operator and literal values.
 * <p>
 * Values are plain literals; store adapters must bind them as parameters.
 * Single-value operators always carry exactly one value.
 * </p>
 */
public final class FilterCondition {

    private final FilterField field;
    private final FilterOperator operator;
    private final List<String> values;

    public FilterCondition(FilterField field, FilterOperator operator, List<String> values) {
        if (field == null || operator == null) {
            throw new IllegalArgumentException("field and operator cannot be null");
        }
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values cannot be null or empty");
        }
        if (!operator.isSetOperator() && values.size() != 1) {
            throw new IllegalArgumentException(
                    "operator " + operator.getKey() + " takes exactly one value");
        }
        this.field = field;
        this.operator = operator;
        this.values = List.copyOf(values);
    }

    public FilterField getField() {
        return field;
    }

    public FilterOperator getOperator() {
        return operator;
    }

    public List<String> getValues() {
        return values;
    }

    /** @return the single value of a single-value operator */
    public String getValue() {
        return values.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        FilterCondition that = (FilterCondition) o;
        return field == that.field && operator == that.operator && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, values);
    }

    @Override
    public String toString() {
        return field.getKey() + " " + operator.getKey() + " " + values;
    }
}
