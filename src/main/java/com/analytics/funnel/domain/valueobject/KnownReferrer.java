package com.analytics.funnel.domain.valueobject;

import java.util.Locale;
import java.util.Objects;

/**
 * Registry entry of a well-known referrer domain.
 */
public final class KnownReferrer {

    private final String domain;
    private final ReferrerType type;
    private final String name;

    public KnownReferrer(String domain, ReferrerType type, String name) {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.domain = domain.toLowerCase(Locale.ROOT);
        this.type = type;
        this.name = name != null && !name.isBlank() ? name : this.domain;
    }

    public String getDomain() {
        return domain;
    }

    public ReferrerType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        KnownReferrer that = (KnownReferrer) o;
        return domain.equals(that.domain) && type == that.type && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, type, name);
    }

    @Override
    public String toString() {
        return "KnownReferrer{domain='" + domain + "', type=" + type + ", name='" + name + "'}";
    }
}
