package com.lending.scope.domain;

/**
 * Strategy used to turn a lender into a list of geographic units.
 */
public enum ScopeStrategy {
    /** Caller-supplied geography list. */
    CUSTOM,
    /** Every geography where the lender has at least one matching record. */
    ALL_ACTIVE,
    /** Metros holding at least the threshold share of the lender's national transaction volume. */
    VOLUME_THRESHOLD,
    /** Metros holding at least the threshold share of the lender's branch locations. */
    PRESENCE_THRESHOLD
}
