package com.lending.scope.analysis;

import lombok.Builder;
import lombok.Value;

/**
 * Result of the lightweight data pre-check.
 */
@Value
@Builder
public class DataAvailability {

    String lenderId;
    boolean hasData;
    long recordCount;
    long geographyCount;
    String yearLabel;
}
