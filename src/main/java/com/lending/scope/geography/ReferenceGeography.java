package com.lending.scope.geography;

import com.lending.scope.backend.AnalyticalBackend;
import com.lending.scope.backend.MetroMembership;
import com.lending.scope.cache.ReferenceDataCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Metro membership and names from the geography reference table, cached through
 * {@link ReferenceDataCache}.
 */
@Slf4j
@Component
public class ReferenceGeography {

    static final String METRO_REFERENCE_KEY = "geography:metro-reference";

    private final AnalyticalBackend backend;
    private final ReferenceDataCache cache;

    @Value("${lending.cache.geography-ttl:PT6H}")
    private Duration geographyTtl;

    public ReferenceGeography(AnalyticalBackend backend, ReferenceDataCache cache) {
        this.backend = backend;
        this.cache = cache;
    }

    /** Metro code to its member geo codes, both sorted ascending. */
    public Map<String, List<String>> metroMembers() {
        return reference().members();
    }

    /** Member geo codes of a metro, empty when the metro is unknown. */
    public List<String> membersOf(String metroCode) {
        return metroMembers().getOrDefault(metroCode, Collections.emptyList());
    }

    /** Display name of a metro, null when the reference table has none. */
    public String nameOf(String metroCode) {
        return reference().names().get(metroCode);
    }

    private MetroReference reference() {
        return cache.getOrLoad(METRO_REFERENCE_KEY, this::loadReference, ttl());
    }

    private MetroReference loadReference() {
        Map<String, TreeSet<String>> grouped = new TreeMap<>();
        Map<String, String> names = new TreeMap<>();
        for (MetroMembership membership : backend.loadMetroMembership()) {
            if (membership.metroCode() == null || membership.geoCode() == null) {
                continue;
            }
            grouped.computeIfAbsent(membership.metroCode(), k -> new TreeSet<>()).add(membership.geoCode());
            if (membership.metroName() != null) {
                names.putIfAbsent(membership.metroCode(), membership.metroName());
            }
        }
        Map<String, List<String>> members = new TreeMap<>();
        grouped.forEach((metro, geos) -> members.put(metro, List.copyOf(new ArrayList<>(geos))));
        log.info("Metro reference loaded: {} metros, {} named", members.size(), names.size());
        return new MetroReference(Collections.unmodifiableMap(members), Collections.unmodifiableMap(names));
    }

    private Duration ttl() {
        return geographyTtl != null ? geographyTtl : Duration.ofHours(6);
    }

    private record MetroReference(Map<String, List<String>> members, Map<String, String> names) {
    }
}
