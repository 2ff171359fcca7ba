package com.lending.scope.backend;

import java.util.Map;

/**
 * Branch counts per metro for one lender and report year. {@code totalBranches} also includes
 * branches located outside every metro.
 */
public record BranchPresence(int reportYear, Map<String, Long> branchesByMetro, long totalBranches) {

    public BranchPresence {
        branchesByMetro = Map.copyOf(branchesByMetro);
    }
}
