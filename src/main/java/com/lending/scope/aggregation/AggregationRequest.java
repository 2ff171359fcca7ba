package com.lending.scope.aggregation;

import com.lending.scope.domain.YearRange;
import com.lending.scope.filter.FilterPredicateSet;
import com.lending.scope.query.GroupKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One logical aggregation: entity ids on {@code dimension}, optionally restricted to
 * {@code restrictionIds} on the other dimension, over the given years and filters.
 */
@Value
@Builder(toBuilder = true)
public class AggregationRequest {

    @Singular
    List<String> ids;
    Dimension dimension;
    YearRange years;
    @Builder.Default
    FilterPredicateSet filters = FilterPredicateSet.none();
    @Singular
    List<GroupKey> groupKeys;
    /** Ids on {@code dimension.other()}; null means unrestricted. */
    List<String> restrictionIds;
}
