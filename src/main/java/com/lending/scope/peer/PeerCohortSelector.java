package com.lending.scope.peer;

import com.lending.scope.domain.ComparisonGroup;
import com.lending.scope.domain.LenderVolume;
import com.lending.scope.domain.PeerCohort;
import com.lending.scope.domain.SelectionWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the comparison group for a subject lender from a candidate pool.
 * <p>
 * The volume-band mode walks {@link #tiers()} in order (primary band, expanded band with a cap, then
 * plain top-k) and stops at the first tier with a match. Category modes take every candidate of the
 * matching institution type. The subject is always removed from the pool first, compared
 * case-insensitively. An empty pool is not an error: the cohort comes back empty with window
 * {@code none}.
 */
@Slf4j
@Component
public class PeerCohortSelector {

    @Value("${lending.peer.primary-lower:0.5}")
    private BigDecimal primaryLower;

    @Value("${lending.peer.primary-upper:2.0}")
    private BigDecimal primaryUpper;

    @Value("${lending.peer.expanded-lower:0.25}")
    private BigDecimal expandedLower;

    @Value("${lending.peer.expanded-upper:4.0}")
    private BigDecimal expandedUpper;

    @Value("${lending.peer.top-k:20}")
    private int topK;

    public PeerCohort selectPeers(LenderVolume subject, List<LenderVolume> candidatePool, ComparisonGroup comparisonGroup) {
        ComparisonGroup group = comparisonGroup != null ? comparisonGroup : ComparisonGroup.PEERS;
        List<LenderVolume> candidates = candidatePool.stream()
                .filter(c -> c != null && c.getLenderId() != null)
                .filter(c -> !c.isSameLender(subject.getLenderId()))
                .map(PeerCohortSelector::withAmount)
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            log.info("Empty candidate pool for subject={}, proceeding without peers", subject.getLenderId());
            return cohort(subject, group, SelectionWindow.NONE, List.of());
        }

        if (!group.isVolumeBand()) {
            List<LenderVolume> matching = candidates.stream()
                    .filter(c -> group.matchesCategory(c.getCategory()))
                    .sorted(SelectionTier.BY_ID)
                    .collect(Collectors.toList());
            SelectionWindow window = matching.isEmpty() ? SelectionWindow.NONE : SelectionWindow.CATEGORY;
            log.info("Category peers selected: subject={} group={} peers={} of {} candidates",
                    subject.getLenderId(), group, matching.size(), candidates.size());
            return cohort(subject, group, window, matching);
        }

        BigDecimal subjectAmount = subject.getTotalAmount() != null ? subject.getTotalAmount() : BigDecimal.ZERO;
        for (SelectionTier tier : tiers()) {
            List<LenderVolume> peers = tier.apply(subjectAmount, candidates);
            if (!peers.isEmpty()) {
                log.info("Peers selected: subject={} amount={} window={} peers={} of {} candidates",
                        subject.getLenderId(), subjectAmount, tier.window().label(), peers.size(), candidates.size());
                return cohort(subject, group, tier.window(), peers);
            }
            log.debug("Tier {} empty for subject={}, falling back", tier.window().label(), subject.getLenderId());
        }
        // top-k only comes back empty when the cap is zero
        log.warn("No peers selected for subject={} (topK={})", subject.getLenderId(), topK);
        return cohort(subject, group, SelectionWindow.NONE, List.of());
    }

    /** Volume-band fallback tiers, evaluated in order. */
    List<SelectionTier> tiers() {
        List<SelectionTier> tiers = new ArrayList<>();
        tiers.add(SelectionTier.band(SelectionWindow.PRIMARY, primaryLower, primaryUpper, null));
        tiers.add(SelectionTier.band(SelectionWindow.EXPANDED, expandedLower, expandedUpper, topK));
        tiers.add(SelectionTier.topK(SelectionWindow.TOP_K, topK));
        return tiers;
    }

    private static LenderVolume withAmount(LenderVolume candidate) {
        return candidate.getTotalAmount() != null ? candidate : candidate.toBuilder().totalAmount(BigDecimal.ZERO).build();
    }

    private static PeerCohort cohort(LenderVolume subject, ComparisonGroup group, SelectionWindow window, List<LenderVolume> peers) {
        return PeerCohort.builder()
                .subject(subject)
                .peers(peers)
                .selectionMethod(group)
                .windowUsed(window)
                .build();
    }
}
