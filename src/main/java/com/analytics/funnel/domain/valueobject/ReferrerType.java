package com.analytics.funnel.domain.valueobject;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Traffic source classification of a referrer.
 */
public enum ReferrerType {

    DIRECT,
    SEARCH,
    SOCIAL,
    EMAIL,
    UNKNOWN;

    /**
     * Maps a registry category to a referrer type. Unrecognized categories map
     * to UNKNOWN.
     *
     * @param category registry category, e.g. "search"
     * @return matching type
     */
    public static ReferrerType fromCategory(String category) {
        if (category == null) {
            return UNKNOWN;
        }
        for (ReferrerType type : values()) {
            if (type.name().equalsIgnoreCase(category.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
