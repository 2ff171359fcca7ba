package com.lending.scope.filter;

/**
 * The recognized filter options, in the order their predicates are rendered.
 */
public enum FilterOption {
    DISPOSITION,
    OCCUPANCY,
    PROPERTY_TYPE,
    FINANCING_METHOD,
    LOAN_CATEGORY,
    LOAN_PURPOSE,
    RESCISSION
}
