package com.lending.scope.query;

/**
 * Grouping keys an aggregation can use. The alias is the result-set column name.
 */
public enum GroupKey {
    LENDER_ID(Column.LENDER_ID, "lender_id"),
    GEO_CODE(Column.GEO_CODE, "geo_code"),
    METRO_CODE(Column.METRO_CODE, "metro_code"),
    YEAR(Column.ACTIVITY_YEAR, "activity_year"),
    LENDER_CATEGORY(Column.LENDER_TYPE, "lender_category");

    private final Column column;
    private final String alias;

    GroupKey(Column column, String alias) {
        this.column = column;
        this.alias = alias;
    }

    public Column column() {
        return column;
    }

    public String alias() {
        return alias;
    }
}
