package com.analytics.funnel.application.port.out;

import java.util.Optional;

import com.analytics.funnel.domain.valueobject.KnownReferrer;

/**
 * Secondary (outbound) port: static registry of well-known referrer domains.
 */
public interface ReferrerRegistry {

    /**
     * Exact lookup of a domain. Suffix matching is the caller's concern.
     *
     * @param domain lower-case domain, e.g. "google.com"
     * @return registry entry, or empty if the domain is unknown
     */
    Optional<KnownReferrer> find(String domain);
}
