package com.lending.scope.boundary;

import com.lending.scope.domain.BoundaryCrosswalkEntry;
import com.lending.scope.domain.TransactionRecord;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps legacy-coded records of the affected jurisdiction to the canonical geo code that replaced
 * their county, using the tract-suffix crosswalk. Anything outside the jurisdiction, on or after
 * the cutover year, or without a crosswalk match keeps its raw code and is still counted.
 * <p>
 * The same rule is rendered into SQL by {@link com.lending.scope.query.SqlRenderer} for every query
 * that filters or groups by geo code. The crosswalk is loaded and checked once at start-up and never
 * changes: a tract suffix listed twice would make the SQL join count a record twice, so it is rejected.
 */
@Slf4j
@Component
public class BoundaryNormalizer {

    private final BoundaryRule rule;
    private final CrosswalkSource crosswalkSource;
    private volatile Map<String, String> crosswalk;

    public BoundaryNormalizer(BoundaryRule rule, CrosswalkSource crosswalkSource) {
        this.rule = rule;
        this.crosswalkSource = crosswalkSource;
    }

    @PostConstruct
    public void loadCrosswalk() {
        crosswalk();
    }

    public BoundaryRule getRule() {
        return rule;
    }

    public String normalize(TransactionRecord record) {
        return normalize(record.getGeoCode(), record.getCensusTract(), record.getActivityYear());
    }

    public String normalize(String rawGeoCode, String censusTract, int activityYear) {
        if (!rule.isLegacyCoded(rawGeoCode, activityYear)) {
            return rawGeoCode;
        }
        String suffix = rule.tractSuffix(censusTract);
        if (suffix == null) {
            log.debug("Legacy-coded record without tract, keeping geoCode={} year={}", rawGeoCode, activityYear);
            return rawGeoCode;
        }
        String canonical = crosswalk().get(suffix);
        if (canonical == null) {
            log.debug("No crosswalk entry for tractSuffix={}, keeping geoCode={} year={}", suffix, rawGeoCode, activityYear);
            return rawGeoCode;
        }
        return canonical;
    }

    public int crosswalkSize() {
        return crosswalk().size();
    }

    private Map<String, String> crosswalk() {
        Map<String, String> loaded = crosswalk;
        if (loaded == null) {
            synchronized (this) {
                loaded = crosswalk;
                if (loaded == null) {
                    loaded = load();
                    crosswalk = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, String> load() {
        List<BoundaryCrosswalkEntry> entries = crosswalkSource.loadCrosswalk();
        Map<String, String> map = new HashMap<>();
        Set<String> duplicates = new TreeSet<>();
        for (BoundaryCrosswalkEntry entry : entries) {
            if (entry.tractSuffix() == null || entry.tractSuffix().length() != rule.tractSuffixLength()) {
                throw new IllegalStateException("Crosswalk tract suffix must have " + rule.tractSuffixLength()
                        + " digits: " + entry.tractSuffix());
            }
            if (entry.canonicalGeoCode() == null || !entry.canonicalGeoCode().startsWith(rule.canonicalPrefix())) {
                throw new IllegalStateException("Crosswalk entry " + entry.tractSuffix() + " maps to "
                        + entry.canonicalGeoCode() + ", outside canonical prefix " + rule.canonicalPrefix());
            }
            if (map.putIfAbsent(entry.tractSuffix(), entry.canonicalGeoCode()) != null) {
                duplicates.add(entry.tractSuffix());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Boundary crosswalk lists tract suffixes more than once: " + duplicates);
        }
        log.info("Loaded boundary crosswalk: {} entries (jurisdiction={}, cutoverYear={})",
                map.size(), rule.jurisdictionPrefix(), rule.cutoverYear());
        return Map.copyOf(map);
    }
}
