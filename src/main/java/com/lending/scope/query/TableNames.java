package com.lending.scope.query;

import java.util.regex.Pattern;

/**
 * Backend table names. Names come from configuration and are spliced into SQL text, so each one is
 * checked against a plain (optionally dotted) identifier pattern.
 */
public record TableNames(String transactions,
                         String geographyReference,
                         String boundaryCrosswalk,
                         String lenders,
                         String branchLocations) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*){0,2}");

    public TableNames {
        requireIdentifier("transactions", transactions);
        requireIdentifier("geography-reference", geographyReference);
        requireIdentifier("boundary-crosswalk", boundaryCrosswalk);
        requireIdentifier("lenders", lenders);
        requireIdentifier("branch-locations", branchLocations);
    }

    public static TableNames defaults() {
        return new TableNames("transactions", "geography_reference", "boundary_crosswalk", "lenders", "branch_locations");
    }

    private static void requireIdentifier(String key, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid table name for " + key + ": " + value);
        }
    }
}
