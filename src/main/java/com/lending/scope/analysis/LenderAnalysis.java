package com.lending.scope.analysis;

import com.lending.scope.aggregation.ChunkFailure;
import com.lending.scope.domain.PeerCohort;
import com.lending.scope.domain.ResolvedScope;
import com.lending.scope.domain.YearRange;
import com.lending.scope.query.AggregateRow;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one analysis: the resolved scope, the peer cohort and detail rows (lender, geo code,
 * year) for the subject and its peers. {@code partial} is true when any aggregation along the way
 * lost a chunk.
 */
@Value
@Builder
public class LenderAnalysis {

    String lenderId;
    YearRange years;
    ResolvedScope scope;
    PeerCohort cohort;
    @Singular
    List<AggregateRow> detailRows;
    boolean partial;
    @Singular
    List<ChunkFailure> failures;
}
