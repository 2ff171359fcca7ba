package com.lending.scope.backend;

import com.lending.scope.boundary.CrosswalkSource;
import com.lending.scope.query.AggregateRow;
import com.lending.scope.query.GroupKey;
import com.lending.scope.query.RenderedQuery;

import java.util.List;
import java.util.Optional;

/**
 * Read-only port to the analytical store holding transaction records and their reference tables.
 * Implementations may throw any runtime exception on failure; callers decide whether that is fatal.
 */
public interface AnalyticalBackend extends CrosswalkSource {

    /** Runs a rendered grouped-sum query and maps each row by the given group keys. */
    List<AggregateRow> aggregate(RenderedQuery query, List<GroupKey> groupKeys);

    /** Runs a rendered availability query. */
    AvailabilityCounts availability(RenderedQuery query);

    /** Every geography that belongs to a metro, with the metro it belongs to. */
    List<MetroMembership> loadMetroMembership();

    /** Most recent branch report year for the lender, if it has any branch rows. */
    Optional<Integer> latestBranchReportYear(String lenderId);

    /** Branch locations of a lender in one report year, counted per metro. */
    BranchPresence branchPresence(String lenderId, int reportYear);
}
