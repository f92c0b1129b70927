package com.analytics.funnel.domain.analytics;

import java.util.Locale;
import java.util.Objects;

import com.analytics.funnel.domain.valueobject.ReferrerType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parsed referrer: traffic type, display name, canonical domain and raw URL.
 */
public final class ReferrerInfo {

    public static final String DIRECT_KEY = "direct";

    private static final ReferrerInfo DIRECT = new ReferrerInfo(ReferrerType.DIRECT, "Direct", "", "");

    @JsonProperty("type")
    private final ReferrerType type;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("domain")
    private final String domain;

    @JsonProperty("url")
    private final String url;

    public ReferrerInfo(ReferrerType type, String name, String domain, String url) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.type = type;
        this.name = name != null ? name : "";
        this.domain = domain != null ? domain : "";
        this.url = url != null ? url : "";
    }

    public static ReferrerInfo direct() {
        return DIRECT;
    }

    /**
     * Stable grouping key: the lower-cased domain, or "direct" when there is none.
     *
     * @return grouping key
     */
    @JsonIgnore
    public String groupKey() {
        return domain.isEmpty() ? DIRECT_KEY : domain.toLowerCase(Locale.ROOT);
    }

    public ReferrerType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getDomain() {
        return domain;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ReferrerInfo that = (ReferrerInfo) o;
        return type == that.type && name.equals(that.name)
                && domain.equals(that.domain) && url.equals(that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, domain, url);
    }

    @Override
    public String toString() {
        return "ReferrerInfo{type=" + type + ", name='" + name + "', domain='" + domain + "'}";
    }
}
