package com.lending.scope.domain;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Scope strategy plus the inputs it needs.
 */
@Value
@Builder
public class ScopeSpecification {

    @NotNull
    ScopeStrategy strategy;

    /** Geo codes for {@link ScopeStrategy#CUSTOM}; ignored otherwise. */
    @Singular
    List<String> customGeoCodes;

    /**
     * Identifier used against the branch-location table for {@link ScopeStrategy#PRESENCE_THRESHOLD}
     * (branch data is keyed by regulator id, not LEI). Falls back to the lender id when null.
     */
    String presenceLenderId;

    public static ScopeSpecification of(ScopeStrategy strategy) {
        return ScopeSpecification.builder().strategy(strategy).build();
    }

    public static ScopeSpecification custom(List<String> geoCodes) {
        return ScopeSpecification.builder().strategy(ScopeStrategy.CUSTOM).customGeoCodes(geoCodes).build();
    }
}
