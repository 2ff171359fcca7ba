package com.lending.scope.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of scope resolution. {@code geoCodes} is always non-empty, deduplicated and sorted ascending.
 */
@Value
@Builder
public class ResolvedScope {

    ScopeStrategy strategy;
    @Singular
    List<String> geoCodes;
    /** Metros that met the share threshold (threshold strategies only). */
    @Singular
    List<MetroShare> retainedMetros;
    /** True when the aggregation behind the resolution lost at least one chunk. */
    boolean partial;

    public int size() {
        return geoCodes.size();
    }
}
