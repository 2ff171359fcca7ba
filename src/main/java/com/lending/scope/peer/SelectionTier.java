package com.lending.scope.peer;

import com.lending.scope.domain.LenderVolume;
import com.lending.scope.domain.SelectionWindow;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One step of the peer fallback: an optional volume band around the subject and an optional cap.
 * Uncapped tiers return every match ordered by lender id; capped tiers keep the highest-volume
 * candidates, ties broken by lender id.
 *
 * @param window          label recorded on the cohort
 * @param lowerMultiplier band lower bound as a multiple of the subject amount; null for no band
 * @param upperMultiplier band upper bound as a multiple of the subject amount; null for no band
 * @param cap             maximum number of peers; null for no cap
 */
public record SelectionTier(SelectionWindow window, BigDecimal lowerMultiplier, BigDecimal upperMultiplier, Integer cap) {

    static final Comparator<LenderVolume> BY_ID = Comparator.comparing(LenderVolume::getLenderId);
    static final Comparator<LenderVolume> BY_VOLUME_DESC = Comparator
            .comparing(LenderVolume::getTotalAmount)
            .reversed()
            .thenComparing(BY_ID);

    public static SelectionTier band(SelectionWindow window, BigDecimal lower, BigDecimal upper, Integer cap) {
        return new SelectionTier(window, lower, upper, cap);
    }

    public static SelectionTier topK(SelectionWindow window, int cap) {
        return new SelectionTier(window, null, null, cap);
    }

    public boolean hasBand() {
        return lowerMultiplier != null && upperMultiplier != null;
    }

    public List<LenderVolume> apply(BigDecimal subjectAmount, List<LenderVolume> candidates) {
        Stream<LenderVolume> matches = candidates.stream();
        if (hasBand()) {
            BigDecimal min = subjectAmount.multiply(lowerMultiplier);
            BigDecimal max = subjectAmount.multiply(upperMultiplier);
            matches = matches.filter(c -> c.getTotalAmount().compareTo(min) >= 0 && c.getTotalAmount().compareTo(max) <= 0);
        }
        if (cap == null) {
            return matches.sorted(BY_ID).collect(Collectors.toList());
        }
        return matches.sorted(BY_VOLUME_DESC).limit(Math.max(0, cap)).collect(Collectors.toList());
    }
}
