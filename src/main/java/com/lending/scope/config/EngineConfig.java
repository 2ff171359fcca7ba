package com.lending.scope.config;

import com.lending.scope.boundary.BoundaryRule;
import com.lending.scope.cache.ReferenceDataCache;
import com.lending.scope.query.TableNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine-wide beans built from {@code lending.*} properties. Table names and the boundary rule are
 * validated here, so a bad value fails start-up.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Value("${lending.backend.tables.transactions:transactions}")
    private String transactionsTable;

    @Value("${lending.backend.tables.geography-reference:geography_reference}")
    private String geographyReferenceTable;

    @Value("${lending.backend.tables.boundary-crosswalk:boundary_crosswalk}")
    private String boundaryCrosswalkTable;

    @Value("${lending.backend.tables.lenders:lenders}")
    private String lendersTable;

    @Value("${lending.backend.tables.branch-locations:branch_locations}")
    private String branchLocationsTable;

    @Value("${lending.boundary.jurisdiction-prefix:09}")
    private String jurisdictionPrefix;

    @Value("${lending.boundary.canonical-prefix:091}")
    private String canonicalPrefix;

    @Value("${lending.boundary.cutover-year:2024}")
    private int cutoverYear;

    @Value("${lending.boundary.tract-suffix-length:6}")
    private int tractSuffixLength;

    @Value("${lending.cache.maximum-size:1000}")
    private long cacheMaximumSize;

    @Bean
    public TableNames tableNames() {
        TableNames names = new TableNames(transactionsTable, geographyReferenceTable, boundaryCrosswalkTable,
                lendersTable, branchLocationsTable);
        log.info("Analytical backend tables: {}", names);
        return names;
    }

    @Bean
    public BoundaryRule boundaryRule() {
        BoundaryRule rule = new BoundaryRule(jurisdictionPrefix, canonicalPrefix, cutoverYear, tractSuffixLength);
        log.info("Boundary rule: {}", rule);
        return rule;
    }

    @Bean
    public ReferenceDataCache referenceDataCache() {
        return new ReferenceDataCache(cacheMaximumSize);
    }
}
