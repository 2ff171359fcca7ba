package com.lending.scope.aggregation;

import com.lending.scope.query.AggregateRow;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Merged rows of an aggregation. When {@code partial} is true at least one chunk failed and the totals
 * undercount; {@code failures} says which.
 */
@Value
@Builder
public class AggregationResult {

    @Singular
    List<AggregateRow> rows;
    boolean partial;
    @Singular
    List<ChunkFailure> failures;
    int chunkCount;

    public static AggregationResult empty() {
        return AggregationResult.builder().build();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** True when chunks ran and every one of them failed, so an empty result says nothing about the data. */
    public boolean allChunksFailed() {
        return chunkCount > 0 && failures.size() >= chunkCount;
    }

    public long totalCount() {
        return rows.stream().mapToLong(AggregateRow::getTotalCount).sum();
    }

    public BigDecimal totalAmount() {
        return rows.stream().map(AggregateRow::getTotalAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
