package com.lending.scope.domain;

import java.util.Locale;

/**
 * How the comparison group is chosen. {@link #PEERS} uses the volume band; the others select
 * every lender of a type with no volume restriction.
 */
public enum ComparisonGroup {
    PEERS,
    ALL,
    BANKS,
    CREDIT_UNIONS,
    MORTGAGE;

    public boolean isVolumeBand() {
        return this == PEERS;
    }

    /**
     * Whether a lender's institution type name belongs to this group. Matching is by substring on the
     * lower-cased type name, the same way the lender reference table labels institutions.
     */
    public boolean matchesCategory(String typeName) {
        if (this == ALL || this == PEERS) {
            return true;
        }
        if (typeName == null || typeName.isBlank()) {
            return false;
        }
        String type = typeName.toLowerCase(Locale.ROOT);
        switch (this) {
            case BANKS:
                return type.contains("bank") || type.contains("affiliate");
            case CREDIT_UNIONS:
                return type.contains("credit union");
            case MORTGAGE:
                return type.contains("mortgage");
            default:
                return false;
        }
    }
}
