package com.lending.scope.boundary;

import com.lending.scope.domain.BoundaryCrosswalkEntry;

import java.util.List;

/**
 * Where the static crosswalk table is read from.
 */
public interface CrosswalkSource {

    List<BoundaryCrosswalkEntry> loadCrosswalk();
}
