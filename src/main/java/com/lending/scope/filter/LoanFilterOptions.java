package com.lending.scope.filter;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Business-level loan filters as the caller expresses them. Any option left null falls back to its
 * default in {@link FilterSpecificationTranslator}.
 */
@Value
@Builder
public class LoanFilterOptions {

    /** {@code completed} (originations) or {@code all-stages} (every application outcome). */
    String disposition;
    /** Subset of {@code primary}, {@code second-home}, {@code investment}. */
    List<String> occupancy;
    /** Subset of {@code 1-4 unit}, {@code 5+ unit}. */
    List<String> propertyType;
    /** Subset of {@code site-built}, {@code manufactured}. */
    List<String> financingMethod;
    /** Subset of {@code conventional}, {@code fha}, {@code va}, {@code rhs} or raw loan-type codes. */
    List<String> loanCategory;
    /** Subset of {@code purchase}, {@code refinance}, {@code home-equity}; null means all purposes. */
    List<String> loanPurpose;
    /** Exclude reverse mortgages (rescission-eligible); defaults to true. */
    Boolean excludeRescissionEligible;

    public static LoanFilterOptions defaults() {
        return LoanFilterOptions.builder().build();
    }
}
