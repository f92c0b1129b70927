package com.analytics.funnel.application.service;

import java.net.IDN;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.analytics.funnel.application.port.out.ReferrerRegistry;
import com.analytics.funnel.domain.analytics.ReferrerInfo;
import com.analytics.funnel.domain.valueobject.KnownReferrer;
import com.analytics.funnel.domain.valueobject.ReferrerType;

/**
 * Parses raw referrer URLs into {type, name, domain, url}.
 * <p>
 * Resolution order:
 * </p>
 * <ol>
 * <li>empty, "direct" or without a usable host → direct</li>
 * <li>host equal to, or a subdomain of, the site's own host → direct</li>
 * <li>longest registry suffix of the host ({@code www.google.com} →
 * {@code google.com})</li>
 * <li>query carries {@code q}, {@code query} or {@code search} → search</li>
 * <li>otherwise unknown, named after the host</li>
 * </ol>
 * <p>
 * Hosts are read leniently, the way browsers read them: spaces or braces in
 * the query and underscores in the host are accepted, and international hosts
 * are converted to their ASCII (punycode) form.
 * </p>
 */
public class ReferrerCanonicalizer {

    private static final Set<String> SEARCH_PARAMETERS = Set.of("q", "query", "search");
    private static final String WWW_PREFIX = "www.";
    private static final String FORBIDDEN_HOST_CHARACTERS = " \t<>^|%@[]";

    private final ReferrerRegistry registry;

    public ReferrerCanonicalizer(ReferrerRegistry registry) {
        if (registry == null)
            throw new IllegalArgumentException("registry cannot be null");
        this.registry = registry;
    }

    /**
     * @param rawReferrer referrer URL, may be null or empty
     * @param siteHost    the tracked site's own hostname, may be null
     * @return parsed referrer
     */
    public ReferrerInfo canonicalize(String rawReferrer, String siteHost) {
        if (rawReferrer == null || rawReferrer.isBlank()
                || ReferrerInfo.DIRECT_KEY.equalsIgnoreCase(rawReferrer.trim())) {
            return ReferrerInfo.direct();
        }

        String url = rawReferrer.trim();
        Optional<ParsedUrl> parsed = parse(url);
        if (parsed.isEmpty()) {
            return ReferrerInfo.direct();
        }

        String host = parsed.get().host;
        if (isSelfReferral(host, siteHost)) {
            return ReferrerInfo.direct();
        }

        Optional<KnownReferrer> known = lookupLongestSuffix(host);
        if (known.isPresent()) {
            KnownReferrer entry = known.get();
            return new ReferrerInfo(entry.getType(), entry.getName(), entry.getDomain(), url);
        }

        String domain = stripWww(host);
        if (hasSearchParameter(parsed.get().query)) {
            return new ReferrerInfo(ReferrerType.SEARCH, host, domain, url);
        }
        return new ReferrerInfo(ReferrerType.UNKNOWN, host, domain, url);
    }

    /**
     * Grouping key of a raw referrer.
     *
     * @return lower-cased canonical domain, or "direct"
     */
    public String groupKey(String rawReferrer, String siteHost) {
        return canonicalize(rawReferrer, siteHost).groupKey();
    }

    /**
     * Tries the full host, then strips the leftmost label until a registry
     * entry is found or no dotted suffix remains.
     */
    Optional<KnownReferrer> lookupLongestSuffix(String host) {
        String candidate = host;
        while (true) {
            Optional<KnownReferrer> entry = registry.find(candidate);
            if (entry.isPresent()) {
                return entry;
            }
            int dot = candidate.indexOf('.');
            if (dot < 0 || dot == candidate.length() - 1) {
                return Optional.empty();
            }
            candidate = candidate.substring(dot + 1);
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    /**
     * Splits {@code scheme://userinfo@host:port/path?query#fragment} by hand.
     * Only the host and the query are kept.
     */
    Optional<ParsedUrl> parse(String url) {
        int schemeEnd = url.indexOf("://");
        String rest = schemeEnd >= 0 ? url.substring(schemeEnd + 3) : url;

        int authorityEnd = indexOfAny(rest, "/?#\\");
        String authority = authorityEnd >= 0 ? rest.substring(0, authorityEnd) : rest;
        String tail = authorityEnd >= 0 ? rest.substring(authorityEnd) : "";

        int at = authority.lastIndexOf('@');
        String host = at >= 0 ? authority.substring(at + 1) : authority;
        int colon = host.lastIndexOf(':');
        if (colon >= 0 && isPort(host.substring(colon + 1))) {
            host = host.substring(0, colon);
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (host.isEmpty() || indexOfAny(host, FORBIDDEN_HOST_CHARACTERS) >= 0 || host.contains(":")) {
            return Optional.empty();
        }
        try {
            host = IDN.toASCII(host, IDN.ALLOW_UNASSIGNED).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (host.isEmpty()) {
            return Optional.empty();
        }

        String query = null;
        int question = tail.indexOf('?');
        if (question >= 0) {
            int hash = tail.indexOf('#', question);
            query = hash >= 0 ? tail.substring(question + 1, hash) : tail.substring(question + 1);
        }
        return Optional.of(new ParsedUrl(host, query));
    }

    private boolean isSelfReferral(String host, String siteHost) {
        if (siteHost == null || siteHost.isBlank()) {
            return false;
        }
        String site = stripWww(siteHost.trim().toLowerCase(Locale.ROOT));
        String referrer = stripWww(host);
        return referrer.equals(site) || referrer.endsWith("." + site);
    }

    private boolean hasSearchParameter(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return false;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            if (SEARCH_PARAMETERS.contains(name.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static int indexOfAny(String value, String characters) {
        for (int i = 0; i < value.length(); i++) {
            if (characters.indexOf(value.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isPort(String value) {
        if (value.length() > 5) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String stripWww(String host) {
        return host.startsWith(WWW_PREFIX) && host.length() > WWW_PREFIX.length()
                ? host.substring(WWW_PREFIX.length())
                : host;
    }

    /** Host and raw query of a referrer URL. */
    static final class ParsedUrl {

        final String host;
        final String query;

        ParsedUrl(String host, String query) {
            this.host = host;
            this.query = query;
        }
    }
}
