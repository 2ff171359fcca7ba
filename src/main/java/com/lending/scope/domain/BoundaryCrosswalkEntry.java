package com.lending.scope.domain;

/**
 * Maps the tract suffix of a legacy-coded record to the canonical geo code that replaced its county.
 */
public record BoundaryCrosswalkEntry(String tractSuffix, String canonicalGeoCode) {
}
