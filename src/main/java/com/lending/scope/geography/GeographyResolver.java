package com.lending.scope.geography;

import com.lending.scope.aggregation.AggregationRequest;
import com.lending.scope.aggregation.AggregationResult;
import com.lending.scope.aggregation.BackendChunkException;
import com.lending.scope.aggregation.BatchedAggregationEngine;
import com.lending.scope.aggregation.Dimension;
import com.lending.scope.backend.AnalyticalBackend;
import com.lending.scope.backend.BranchPresence;
import com.lending.scope.domain.MetroShare;
import com.lending.scope.domain.ResolvedScope;
import com.lending.scope.domain.ScopeSpecification;
import com.lending.scope.domain.ScopeStrategy;
import com.lending.scope.domain.YearRange;
import com.lending.scope.filter.FilterPredicateSet;
import com.lending.scope.query.AggregateRow;
import com.lending.scope.query.GroupKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns a lender and a {@link ScopeSpecification} into the sorted, de-duplicated list of geo codes
 * the analysis runs over.
 * <ul>
 *   <li>{@code CUSTOM}: the caller's list, trimmed and zero-padded to five digits.</li>
 *   <li>{@code ALL_ACTIVE}: every geography where the lender has a matching record.</li>
 *   <li>{@code VOLUME_THRESHOLD}: every member geography of each metro holding at least the threshold
 *       share of the lender's national matching records or of their loan amount (see {@link ShareMeasure}).</li>
 *   <li>{@code PRESENCE_THRESHOLD}: the same rule over branch locations in the latest report year.</li>
 * </ul>
 * The share denominator is the lender's total over all matching records, including records outside
 * every metro, and the threshold is inclusive.
 */
@Slf4j
@Service
public class GeographyResolver {

    static final int GEO_CODE_LENGTH = 5;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BatchedAggregationEngine aggregationEngine;
    private final ReferenceGeography referenceGeography;
    private final AnalyticalBackend backend;

    @Value("${lending.scope.metro-share-threshold-percent:1.0}")
    private BigDecimal thresholdPercent;

    @Value("${lending.scope.volume-measure:COUNT_OR_AMOUNT}")
    private ShareMeasure volumeMeasure;

    @Value("${lending.scope.near-miss-limit:10}")
    private int nearMissLimit;

    public GeographyResolver(BatchedAggregationEngine aggregationEngine,
                             ReferenceGeography referenceGeography,
                             AnalyticalBackend backend) {
        this.aggregationEngine = aggregationEngine;
        this.referenceGeography = referenceGeography;
        this.backend = backend;
    }

    public ResolvedScope resolveScope(String lenderId, ScopeSpecification spec, YearRange years, FilterPredicateSet filters) {
        ScopeStrategy strategy = spec.getStrategy();
        log.info("Resolving scope: lenderId={} strategy={} years={}", lenderId, strategy, years.label());
        ResolvedScope scope;
        switch (strategy) {
            case CUSTOM:
                scope = resolveCustom(spec.getCustomGeoCodes());
                break;
            case ALL_ACTIVE:
                scope = resolveAllActive(lenderId, years, filters);
                break;
            case VOLUME_THRESHOLD:
                scope = resolveVolumeThreshold(lenderId, years, filters);
                break;
            case PRESENCE_THRESHOLD:
                String presenceId = spec.getPresenceLenderId() != null ? spec.getPresenceLenderId() : lenderId;
                scope = resolvePresenceThreshold(presenceId);
                break;
            default:
                throw new IllegalArgumentException("Unsupported scope strategy: " + strategy);
        }
        log.info("Scope resolved: lenderId={} strategy={} geoCodes={} metros={} partial={}",
                lenderId, strategy, scope.size(), scope.getRetainedMetros().size(), scope.isPartial());
        return scope;
    }

    ResolvedScope resolveCustom(List<String> geoCodes) {
        TreeSet<String> codes = new TreeSet<>();
        if (geoCodes != null) {
            for (String raw : geoCodes) {
                String code = normalizeGeoCode(raw);
                if (code != null) {
                    codes.add(code);
                }
            }
        }
        if (codes.isEmpty()) {
            throw new EmptyScopeException("Custom geography list is empty");
        }
        return ResolvedScope.builder()
                .strategy(ScopeStrategy.CUSTOM)
                .geoCodes(new ArrayList<>(codes))
                .build();
    }

    private ResolvedScope resolveAllActive(String lenderId, YearRange years, FilterPredicateSet filters) {
        AggregationResult result = aggregateLender(lenderId, years, filters, GroupKey.GEO_CODE);
        TreeSet<String> codes = new TreeSet<>();
        for (AggregateRow row : result.getRows()) {
            String geo = row.getString(GroupKey.GEO_CODE);
            if (geo != null && row.getTotalCount() > 0) {
                codes.add(geo);
            }
        }
        if (codes.isEmpty()) {
            throw new NoActivityException(noActivityMessage(lenderId, years, result));
        }
        return ResolvedScope.builder()
                .strategy(ScopeStrategy.ALL_ACTIVE)
                .geoCodes(new ArrayList<>(codes))
                .partial(result.isPartial())
                .build();
    }

    private ResolvedScope resolveVolumeThreshold(String lenderId, YearRange years, FilterPredicateSet filters) {
        AggregationResult result = aggregateLender(lenderId, years, filters, GroupKey.METRO_CODE);
        long totalCount = 0;
        BigDecimal totalAmount = BigDecimal.ZERO;
        Map<String, MetroTotals> byMetro = new LinkedHashMap<>();
        for (AggregateRow row : result.getRows()) {
            totalCount += row.getTotalCount();
            totalAmount = totalAmount.add(row.getTotalAmount());
            String metro = row.getString(GroupKey.METRO_CODE);
            if (metro != null) {
                byMetro.computeIfAbsent(metro, k -> new MetroTotals()).add(row.getTotalCount(), row.getTotalAmount());
            }
        }
        if (totalCount <= 0 && totalAmount.signum() <= 0) {
            throw new NoActivityException(noActivityMessage(lenderId, years, result));
        }
        log.debug("Volume shares for lenderId={}: measure={} records={} amount={} metros={}",
                lenderId, volumeMeasure, totalCount, totalAmount, byMetro.size());
        return applyThreshold(ScopeStrategy.VOLUME_THRESHOLD, lenderId, volumeMeasure, byMetro,
                totalCount, totalAmount, result.isPartial());
    }

    private ResolvedScope resolvePresenceThreshold(String presenceLenderId) {
        Optional<Integer> latestYear = backend.latestBranchReportYear(presenceLenderId);
        if (latestYear.isEmpty()) {
            throw new NoActivityException("No branch locations found for lender " + presenceLenderId);
        }
        BranchPresence presence = backend.branchPresence(presenceLenderId, latestYear.get());
        if (presence.totalBranches() <= 0) {
            throw new NoActivityException("No branch locations found for lender " + presenceLenderId
                    + " in report year " + presence.reportYear());
        }
        log.debug("Branch presence for lenderId={}: reportYear={} branches={} metros={}",
                presenceLenderId, presence.reportYear(), presence.totalBranches(), presence.branchesByMetro().size());
        Map<String, MetroTotals> byMetro = new LinkedHashMap<>();
        presence.branchesByMetro().forEach((metro, count) ->
                byMetro.computeIfAbsent(metro, k -> new MetroTotals()).add(count, BigDecimal.ZERO));
        return applyThreshold(ScopeStrategy.PRESENCE_THRESHOLD, presenceLenderId, ShareMeasure.COUNT, byMetro,
                presence.totalBranches(), BigDecimal.ZERO, false);
    }

    private ResolvedScope applyThreshold(ScopeStrategy strategy, String lenderId, ShareMeasure measure,
                                         Map<String, MetroTotals> byMetro, long totalCount, BigDecimal totalAmount,
                                         boolean partial) {
        List<MetroShare> retained = new ArrayList<>();
        List<MetroShare> memberless = new ArrayList<>();
        List<MetroShare> missed = new ArrayList<>();
        TreeSet<String> codes = new TreeSet<>();
        for (Map.Entry<String, MetroTotals> entry : byMetro.entrySet()) {
            MetroTotals totals = entry.getValue();
            MetroShare share = toShare(entry.getKey(), totals, totalCount, totalAmount, measure);
            if (!measure.qualifies(totals.count, totals.amount, totalCount, totalAmount, thresholdPercent)) {
                missed.add(share);
                continue;
            }
            List<String> members = referenceGeography.membersOf(entry.getKey());
            if (members.isEmpty()) {
                log.warn("Metro {} met the threshold but has no member geographies", entry.getKey());
                memberless.add(share);
                continue;
            }
            retained.add(share);
            codes.addAll(members);
        }
        retained.sort(SHARE_ORDER);

        if (retained.isEmpty()) {
            missed.sort(SHARE_ORDER);
            List<MetroShare> nearMisses = missed.stream().limit(Math.max(0, nearMissLimit)).collect(Collectors.toList());
            String message;
            if (memberless.isEmpty()) {
                message = "No metro area holds at least " + thresholdPercent.toPlainString()
                        + "% of activity for lender " + lenderId;
            } else {
                message = "Metro areas " + memberless.stream().map(MetroShare::metroCode).sorted().collect(Collectors.toList())
                        + " hold at least " + thresholdPercent.toPlainString() + "% of activity for lender " + lenderId
                        + " but have no member geographies";
            }
            log.warn("{} (strategy={}); closest: {}", message, strategy, nearMisses);
            throw new NoQualifyingMetroException(message, nearMisses, totalCount, totalAmount);
        }
        return ResolvedScope.builder()
                .strategy(strategy)
                .geoCodes(new ArrayList<>(codes))
                .retainedMetros(retained)
                .partial(partial)
                .build();
    }

    private MetroShare toShare(String metroCode, MetroTotals totals, long totalCount, BigDecimal totalAmount,
                               ShareMeasure measure) {
        BigDecimal countShare = sharePercent(BigDecimal.valueOf(totals.count), BigDecimal.valueOf(totalCount));
        BigDecimal amountShare = sharePercent(totals.amount, totalAmount);
        return new MetroShare(metroCode, referenceGeography.nameOf(metroCode), totals.count, totals.amount,
                countShare, amountShare, measure.rankingShare(countShare, amountShare));
    }

    private AggregationResult aggregateLender(String lenderId, YearRange years, FilterPredicateSet filters, GroupKey key) {
        AggregationResult result = aggregationEngine.aggregate(AggregationRequest.builder()
                .id(lenderId)
                .dimension(Dimension.LENDER_ID)
                .years(years)
                .filters(filters)
                .groupKey(key)
                .build());
        if (result.allChunksFailed()) {
            throw new BackendChunkException("Every aggregation chunk failed for lender " + lenderId + " in "
                    + years.label() + ": " + result.getFailures().get(0).cause());
        }
        return result;
    }

    private static String noActivityMessage(String lenderId, YearRange years, AggregationResult result) {
        String message = "No matching records for lender " + lenderId + " in " + years.label();
        return result.isPartial() ? message + " (backend returned partial results)" : message;
    }

    /** Share in percent, four decimals; zero when the total is not positive. */
    static BigDecimal sharePercent(BigDecimal measure, BigDecimal total) {
        if (total.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return measure.multiply(HUNDRED).divide(total, 4, RoundingMode.HALF_UP);
    }

    /** Trimmed, left-padded to five digits when numeric; null when blank. */
    static String normalizeGeoCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String code = raw.trim();
        if (code.length() < GEO_CODE_LENGTH && code.chars().allMatch(Character::isDigit)) {
            code = "0".repeat(GEO_CODE_LENGTH - code.length()) + code;
        }
        return code;
    }

    private static final Comparator<MetroShare> SHARE_ORDER = Comparator
            .comparing(MetroShare::sharePercent)
            .reversed()
            .thenComparing(MetroShare::metroCode);

    private static final class MetroTotals {
        private long count;
        private BigDecimal amount = BigDecimal.ZERO;

        void add(long records, BigDecimal value) {
            count += records;
            amount = amount.add(value);
        }
    }
}
