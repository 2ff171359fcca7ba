package com.lending.scope.backend;

/**
 * Row of the geography reference table: a geo code and the metro it belongs to.
 */
public record MetroMembership(String geoCode, String metroCode, String metroName) {
}
