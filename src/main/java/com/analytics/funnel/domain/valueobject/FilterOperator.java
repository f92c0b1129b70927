package com.analytics.funnel.domain.valueobject;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators supported by funnel filters.
 */
public enum FilterOperator {

    EQUALS("equals"),
    NOT_EQUALS("not_equals"),
    CONTAINS("contains"),
    IN("in"),
    NOT_IN("not_in");

    private final String key;

    FilterOperator(String key) {
        this.key = key;
    }

    public static Optional<FilterOperator> fromKey(String key) {
        return Arrays.stream(values())
                .filter(op -> op.key.equals(key))
                .findFirst();
    }

    /**
     * Checks if this operator compares against a set of values.
     *
     * @return true if IN or NOT_IN
     */
    public boolean isSetOperator() {
        return this == IN || this == NOT_IN;
    }

    public String getKey() {
        return key;
    }
}
