package com.analytics.funnel.adapters.out.registry;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import com.analytics.funnel.application.port.out.ReferrerRegistry;
import com.analytics.funnel.domain.valueobject.KnownReferrer;
import com.analytics.funnel.domain.valueobject.ReferrerType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * ReferrerRegistry backed by a JSON document loaded once at startup.
 * <p>
 * Document shape: {@code [{"domain": "google.com", "category": "search",
 * "name": "Google"}, ...]}. Entries without a domain are skipped; a later
 * entry for the same domain, compared case-insensitively, replaces an earlier
 * one.
 * </p>
 */
public class JsonReferrerRegistry implements ReferrerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JsonReferrerRegistry.class);

    private final Map<String, KnownReferrer> entries;

    /**
     * @param entries registry entries keyed by domain; keys are matched
     *                case-insensitively
     */
    public JsonReferrerRegistry(Map<String, KnownReferrer> entries) {
        Map<String, KnownReferrer> byDomain = new HashMap<>();
        entries.forEach((domain, entry) -> byDomain.put(domain.toLowerCase(Locale.ROOT), entry));
        this.entries = Collections.unmodifiableMap(byDomain);
    }

    /**
     * Loads the registry document.
     *
     * @param resource     JSON document
     * @param objectMapper mapper used to read it
     * @return loaded registry
     * @throws IllegalStateException if the document cannot be read or parsed
     */
    public static JsonReferrerRegistry load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            List<EntryDto> dtos = objectMapper.readValue(in, new TypeReference<List<EntryDto>>() {
            });
            Map<String, KnownReferrer> entries = new HashMap<>();
            for (EntryDto dto : dtos) {
                if (dto.getDomain() == null || dto.getDomain().isBlank()) {
                    continue;
                }
                KnownReferrer entry = dto.toDomain();
                entries.put(entry.getDomain().toLowerCase(Locale.ROOT), entry);
            }
            log.info("action=referrer_registry_loaded source={} entries={}", resource.getDescription(), entries.size());
            return new JsonReferrerRegistry(entries);
        } catch (IOException e) {
            log.error("action=referrer_registry_load_error source={} error={}",
                    resource.getDescription(), e.getMessage());
            throw new IllegalStateException("Failed to load referrer registry: " + resource.getDescription(), e);
        }
    }

    @Override
    public Optional<KnownReferrer> find(String domain) {
        if (domain == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(domain.toLowerCase(Locale.ROOT)));
    }

    public int size() {
        return entries.size();
    }

    // ─────────────────── Inner DTO ───────────────────

    /**
     * Serialization DTO of one registry entry.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EntryDto {

        @JsonProperty("domain")
        private String domain;

        @JsonProperty("category")
        private String category;

        @JsonProperty("name")
        private String name;

        public EntryDto() {
        } // Jackson

        public KnownReferrer toDomain() {
            return new KnownReferrer(domain.trim(), ReferrerType.fromCategory(category), name);
        }

        public String getDomain() {
            return domain;
        }

        public void setDomain(String domain) {
            this.domain = domain;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
