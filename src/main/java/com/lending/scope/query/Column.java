package com.lending.scope.query;

/**
 * Logical columns the engine filters and groups on. {@link #GEO_CODE} is the boundary-normalized
 * county code and has no physical column; the renderer substitutes the normalization expression.
 */
public enum Column {
    LENDER_ID("t", "lender_id"),
    GEO_CODE(null, null),
    RAW_GEO_CODE("t", "geo_code"),
    CENSUS_TRACT("t", "census_tract"),
    ACTIVITY_YEAR("t", "activity_year"),
    ACTION_TAKEN("t", "action_taken"),
    OCCUPANCY_TYPE("t", "occupancy_type"),
    TOTAL_UNITS("t", "total_units"),
    CONSTRUCTION_METHOD("t", "construction_method"),
    LOAN_TYPE("t", "loan_type"),
    LOAN_PURPOSE("t", "loan_purpose"),
    REVERSE_MORTGAGE("t", "reverse_mortgage"),
    LOAN_AMOUNT("t", "loan_amount"),
    METRO_CODE("g", "metro_code"),
    LENDER_TYPE("l", "type_name");

    private final String tableAlias;
    private final String columnName;

    Column(String tableAlias, String columnName) {
        this.tableAlias = tableAlias;
        this.columnName = columnName;
    }

    public boolean isPhysical() {
        return columnName != null;
    }

    public String qualifiedName() {
        if (!isPhysical()) {
            throw new IllegalStateException(name() + " has no physical column");
        }
        return tableAlias + "." + columnName;
    }

    boolean needsGeographyJoin() {
        return this == METRO_CODE;
    }

    boolean needsLenderJoin() {
        return this == LENDER_TYPE;
    }

    boolean needsCrosswalkJoin() {
        return this == GEO_CODE || this == METRO_CODE;
    }
}
