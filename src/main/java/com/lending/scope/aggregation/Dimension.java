package com.lending.scope.aggregation;

import com.lending.scope.query.Column;

/**
 * The entity list an aggregation is chunked over.
 */
public enum Dimension {
    GEO_CODE(Column.GEO_CODE),
    LENDER_ID(Column.LENDER_ID);

    private final Column column;

    Dimension(Column column) {
        this.column = column;
    }

    public Column column() {
        return column;
    }

    /** The dimension restriction ids apply to. */
    public Dimension other() {
        return this == GEO_CODE ? LENDER_ID : GEO_CODE;
    }
}
