package com.lending.scope.analysis;

import com.lending.scope.aggregation.AggregationRequest;
import com.lending.scope.aggregation.AggregationResult;
import com.lending.scope.aggregation.BackendChunkException;
import com.lending.scope.aggregation.BatchedAggregationEngine;
import com.lending.scope.aggregation.ChunkFailure;
import com.lending.scope.aggregation.Dimension;
import com.lending.scope.backend.AvailabilityCounts;
import com.lending.scope.domain.InvalidAnalysisRequestException;
import com.lending.scope.domain.LenderVolume;
import com.lending.scope.domain.PeerCohort;
import com.lending.scope.domain.ResolvedScope;
import com.lending.scope.domain.ScopeStrategy;
import com.lending.scope.domain.YearRange;
import com.lending.scope.filter.FilterPredicateSet;
import com.lending.scope.filter.FilterSpecificationTranslator;
import com.lending.scope.geography.GeographyResolver;
import com.lending.scope.geography.NoActivityException;
import com.lending.scope.geography.ScopeResolutionException;
import com.lending.scope.peer.PeerCohortSelector;
import com.lending.scope.query.AggregateRow;
import com.lending.scope.query.GroupKey;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs a lender analysis end to end: resolve the scope, aggregate volume per lender across it, pick
 * peers, then aggregate detail rows for the subject and its peers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LenderAnalysisService {

    private final Validator validator;
    private final FilterSpecificationTranslator filterTranslator;
    private final GeographyResolver geographyResolver;
    private final BatchedAggregationEngine aggregationEngine;
    private final PeerCohortSelector peerSelector;
    private final AnalysisAuditLogger auditLogger;

    @Value("${lending.years.max-count:5}")
    private int maxYears;

    public LenderAnalysis analyze(AnalysisRequest request) {
        YearRange years = validate(request);
        String lenderId = request.getLenderId().trim();
        auditLogger.logRequest(request, years);
        try {
            FilterPredicateSet filters = filterTranslator.translate(request.getFilters());
            ResolvedScope scope = geographyResolver.resolveScope(lenderId, request.getScope(), years, filters);
            auditLogger.logScope(lenderId, scope);

            AggregationResult volume = aggregationEngine.aggregate(AggregationRequest.builder()
                    .ids(scope.getGeoCodes())
                    .dimension(Dimension.GEO_CODE)
                    .years(years)
                    .filters(filters)
                    .groupKey(GroupKey.LENDER_ID)
                    .groupKey(GroupKey.LENDER_CATEGORY)
                    .build());
            if (volume.allChunksFailed()) {
                throw new BackendChunkException("Every volume chunk failed for lender " + lenderId
                        + ": " + volume.getFailures().get(0).cause());
            }
            List<LenderVolume> pool = toLenderVolumes(volume);
            LenderVolume subject = findSubject(lenderId, pool)
                    .orElseThrow(() -> new NoActivityException("Lender " + lenderId
                            + " has no matching records within the resolved scope for " + years.label()));
            log.info("Volume pass complete: subject={} amount={} count={} pool={} partial={}",
                    subject.getLenderId(), subject.getTotalAmount(), subject.getTotalCount(), pool.size(), volume.isPartial());

            PeerCohort cohort = peerSelector.selectPeers(subject, pool, request.getComparisonGroup());
            auditLogger.logCohort(cohort);

            List<String> lenders = new ArrayList<>();
            lenders.add(subject.getLenderId());
            lenders.addAll(cohort.getPeerIds());
            AggregationResult detail = aggregationEngine.aggregate(AggregationRequest.builder()
                    .ids(scope.getGeoCodes())
                    .dimension(Dimension.GEO_CODE)
                    .restrictionIds(lenders)
                    .years(years)
                    .filters(filters)
                    .groupKey(GroupKey.LENDER_ID)
                    .groupKey(GroupKey.GEO_CODE)
                    .groupKey(GroupKey.YEAR)
                    .build());

            List<ChunkFailure> failures = new ArrayList<>(volume.getFailures());
            failures.addAll(detail.getFailures());
            LenderAnalysis analysis = LenderAnalysis.builder()
                    .lenderId(subject.getLenderId())
                    .years(years)
                    .scope(scope)
                    .cohort(cohort)
                    .detailRows(detail.getRows())
                    .partial(scope.isPartial() || volume.isPartial() || detail.isPartial())
                    .failures(failures)
                    .build();
            if (analysis.isPartial()) {
                log.warn("Analysis for lenderId={} is partial: {} failed chunks", lenderId, failures.size());
            }
            auditLogger.logResult(analysis);
            return analysis;
        } catch (ScopeResolutionException | BackendChunkException e) {
            auditLogger.logFailure(lenderId, e);
            throw e;
        }
    }

    /**
     * Cheap check that the lender has matching records for the requested years, filters and, for
     * custom scopes, geographies. Does not resolve threshold scopes or select peers.
     */
    public DataAvailability checkLenderHasData(AnalysisRequest request) {
        YearRange years = validate(request);
        String lenderId = request.getLenderId().trim();
        FilterPredicateSet filters = filterTranslator.translate(request.getFilters());

        AggregationRequest.AggregationRequestBuilder query = AggregationRequest.builder()
                .years(years)
                .filters(filters);
        if (request.getScope().getStrategy() == ScopeStrategy.CUSTOM) {
            ResolvedScope custom = geographyResolver.resolveScope(lenderId, request.getScope(), years, filters);
            query.ids(custom.getGeoCodes())
                    .dimension(Dimension.GEO_CODE)
                    .restrictionIds(List.of(lenderId));
        } else {
            query.id(lenderId).dimension(Dimension.LENDER_ID);
        }
        AvailabilityCounts counts = aggregationEngine.countAvailability(query.build());
        log.info("Data check: lenderId={} years={} records={} geographies={}",
                lenderId, years.label(), counts.recordCount(), counts.geoCount());
        return DataAvailability.builder()
                .lenderId(lenderId)
                .hasData(counts.recordCount() > 0)
                .recordCount(counts.recordCount())
                .geographyCount(counts.geoCount())
                .yearLabel(years.label())
                .build();
    }

    private YearRange validate(AnalysisRequest request) {
        if (request == null) {
            throw new InvalidAnalysisRequestException("Analysis request is required");
        }
        Set<ConstraintViolation<AnalysisRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new InvalidAnalysisRequestException("Invalid analysis request: " + message);
        }
        return YearRange.of(request.getYears(), maxYears);
    }

    /** One volume per lender; rows split by category are summed, keeping the first category seen. */
    static List<LenderVolume> toLenderVolumes(AggregationResult result) {
        Map<String, LenderVolume> byLender = new LinkedHashMap<>();
        for (AggregateRow row : result.getRows()) {
            String lender = row.getString(GroupKey.LENDER_ID);
            if (lender == null) {
                continue;
            }
            LenderVolume volume = LenderVolume.of(lender, row.getTotalAmount(), row.getTotalCount())
                    .toBuilder()
                    .category(row.getString(GroupKey.LENDER_CATEGORY))
                    .build();
            byLender.merge(lender, volume, (a, b) -> a.toBuilder()
                    .totalAmount(a.getTotalAmount().add(b.getTotalAmount()))
                    .totalCount(a.getTotalCount() + b.getTotalCount())
                    .category(a.getCategory() != null ? a.getCategory() : b.getCategory())
                    .build());
        }
        return new ArrayList<>(byLender.values());
    }

    /** Exact id first, then a case-insensitive match (the pool's spelling wins). */
    static Optional<LenderVolume> findSubject(String lenderId, List<LenderVolume> pool) {
        Optional<LenderVolume> exact = pool.stream().filter(v -> v.getLenderId().equals(lenderId)).findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return pool.stream().filter(v -> v.isSameLender(lenderId)).findFirst();
    }
}
