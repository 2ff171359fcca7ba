package com.lending.scope.boundary;

/**
 * Describes the one coding discontinuity the engine repairs: a jurisdiction whose county codes were
 * replaced by a new scheme from {@code cutoverYear} on. Records coded under the old scheme carry
 * {@code jurisdictionPrefix} but not {@code canonicalPrefix}.
 *
 * @param jurisdictionPrefix state prefix of every code in the jurisdiction (e.g. "09")
 * @param canonicalPrefix    prefix shared by the new-scheme codes (e.g. "091")
 * @param cutoverYear        first reporting year that uses the new scheme
 * @param tractSuffixLength  trailing tract digits used as the crosswalk key
 */
public record BoundaryRule(String jurisdictionPrefix, String canonicalPrefix, int cutoverYear, int tractSuffixLength) {

    public static final int TRACT_GEOID_LENGTH = 11;

    public BoundaryRule {
        if (jurisdictionPrefix == null || !jurisdictionPrefix.matches("\\d+")) {
            throw new IllegalArgumentException("jurisdictionPrefix must be numeric: " + jurisdictionPrefix);
        }
        if (canonicalPrefix == null || !canonicalPrefix.matches("\\d+") || !canonicalPrefix.startsWith(jurisdictionPrefix)) {
            throw new IllegalArgumentException("canonicalPrefix must be numeric and start with " + jurisdictionPrefix);
        }
        if (tractSuffixLength < 1 || tractSuffixLength > TRACT_GEOID_LENGTH) {
            throw new IllegalArgumentException("tractSuffixLength out of range: " + tractSuffixLength);
        }
    }

    /** True when a record with this raw code and year is coded under the legacy scheme. */
    public boolean isLegacyCoded(String rawGeoCode, int activityYear) {
        return rawGeoCode != null
                && rawGeoCode.startsWith(jurisdictionPrefix)
                && !rawGeoCode.startsWith(canonicalPrefix)
                && activityYear < cutoverYear;
    }

    /**
     * Crosswalk key for a tract id: the id is left-padded with zeros to eleven digits, then the last
     * {@code tractSuffixLength} digits are taken. Null or blank tracts have no key.
     */
    public String tractSuffix(String censusTract) {
        if (censusTract == null || censusTract.isBlank()) {
            return null;
        }
        String tract = censusTract.trim();
        if (tract.length() < TRACT_GEOID_LENGTH) {
            tract = "0".repeat(TRACT_GEOID_LENGTH - tract.length()) + tract;
        }
        return tract.substring(tract.length() - tractSuffixLength);
    }
}
