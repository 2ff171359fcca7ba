package com.lending.scope.backend;

/**
 * Matching record count and number of distinct normalized geographies.
 */
public record AvailabilityCounts(long recordCount, long geoCount) {

    public static final AvailabilityCounts EMPTY = new AvailabilityCounts(0, 0);
}
