package com.lending.scope.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Subject lender plus its comparison group. The subject is never part of {@code peers}.
 */
@Value
@Builder
public class PeerCohort {

    LenderVolume subject;
    @Singular
    List<LenderVolume> peers;
    ComparisonGroup selectionMethod;
    SelectionWindow windowUsed;

    public List<String> getPeerIds() {
        return peers.stream().map(LenderVolume::getLenderId).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return peers.isEmpty();
    }
}
