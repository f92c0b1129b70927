package com.analytics.funnel.domain.valueobject;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Allow-list of event attributes a funnel filter may reference.
 * <p>
 * Each constant carries the filter key accepted from definitions and the
 * event log column it targets. {@code browser} and {@code os} are aliases of
 * the {@code browser_name} and {@code os_name} columns.
 * </p>
 */
public enum FilterField {

    EVENT_NAME("event_name", "event_name"),
    PATH("path", "path"),
    REFERRER("referrer", "referrer"),
    USER_AGENT("user_agent", "user_agent"),
    IP_ADDRESS("ip_address", "ip_address"),
    COUNTRY("country", "country"),
    CITY("city", "city"),
    DEVICE_TYPE("device_type", "device_type"),
    BROWSER("browser", "browser_name"),
    BROWSER_NAME("browser_name", "browser_name"),
    OS("os", "os_name"),
    OS_NAME("os_name", "os_name"),
    SCREEN_RESOLUTION("screen_resolution", "screen_resolution"),
    LANGUAGE("language", "language"),
    UTM_SOURCE("utm_source", "utm_source"),
    UTM_MEDIUM("utm_medium", "utm_medium"),
    UTM_CAMPAIGN("utm_campaign", "utm_campaign"),
    UTM_TERM("utm_term", "utm_term"),
    UTM_CONTENT("utm_content", "utm_content");

    private static final Map<String, FilterField> BY_KEY = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(FilterField::getKey, Function.identity())));

    private final String key;
    private final String column;

    FilterField(String key, String column) {
        this.key = key;
        this.column = column;
    }

    /**
     * Looks up an allow-listed field by its filter key.
     *
     * @param key filter key as written in a definition
     * @return the field, or empty if the key is not allow-listed
     */
    public static Optional<FilterField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEY.get(key));
    }

    public String getKey() {
        return key;
    }

    public String getColumn() {
        return column;
    }
}
