package com.lending.scope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the lender scope engine. Provides:
 * <ul>
 *   <li>Geographic scope resolution (custom, all-active, volume and branch-presence thresholds)</li>
 *   <li>Boundary normalization of legacy county codes</li>
 *   <li>Batched aggregation against the analytical backend behind a Resilience4j circuit breaker</li>
 *   <li>Peer cohort selection by volume band or institution type</li>
 * </ul>
 */
@SpringBootApplication
public class LenderScopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LenderScopeApplication.class, args);
    }
}
