package com.lending.scope.geography;

import com.lending.scope.domain.MetroShare;

import java.math.BigDecimal;
import java.util.List;

/**
 * Thrown when the lender is active but no metro with member geographies reaches the share threshold.
 * Carries the metros that came closest, highest share first, and the lender's national totals.
 */
public class NoQualifyingMetroException extends ScopeResolutionException {

    private final List<MetroShare> nearMisses;
    private final long lenderCount;
    private final BigDecimal lenderAmount;

    public NoQualifyingMetroException(String message, List<MetroShare> nearMisses, long lenderCount,
                                      BigDecimal lenderAmount) {
        super(message);
        this.nearMisses = List.copyOf(nearMisses);
        this.lenderCount = lenderCount;
        this.lenderAmount = lenderAmount;
    }

    public List<MetroShare> getNearMisses() {
        return nearMisses;
    }

    public long getLenderCount() {
        return lenderCount;
    }

    public BigDecimal getLenderAmount() {
        return lenderAmount;
    }
}
