package com.lending.scope.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregate of one lender's matching transactions over a geographic scope and filter set.
 * Recomputed per request, never persisted.
 */
@Value
@Builder(toBuilder = true)
public class LenderVolume {

    String lenderId;
    /** Sum of loan amounts. */
    BigDecimal totalAmount;
    /** Number of matching transaction records. */
    long totalCount;
    /** Institution type name from the lender reference table (may be null). */
    String category;

    public static LenderVolume of(String lenderId, BigDecimal totalAmount, long totalCount) {
        return LenderVolume.builder()
                .lenderId(lenderId)
                .totalAmount(totalAmount != null ? totalAmount : BigDecimal.ZERO)
                .totalCount(totalCount)
                .build();
    }

    public boolean isSameLender(String otherLenderId) {
        return lenderId != null && otherLenderId != null && lenderId.equalsIgnoreCase(otherLenderId);
    }
}
