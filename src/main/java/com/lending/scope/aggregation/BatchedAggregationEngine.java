package com.lending.scope.aggregation;

import com.lending.scope.backend.AnalyticalBackend;
import com.lending.scope.backend.AvailabilityCounts;
import com.lending.scope.query.AggregateRow;
import com.lending.scope.query.AggregationQuery;
import com.lending.scope.query.Column;
import com.lending.scope.query.Condition;
import com.lending.scope.query.RenderedQuery;
import com.lending.scope.query.SqlRenderer;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs grouped-sum aggregations over arbitrarily long id lists by splitting them into bounded chunks,
 * querying each chunk through a circuit breaker and summing the rows by group key. Each record matches
 * exactly one chunk, so the merged result does not depend on the batch size or on chunk order.
 * <p>
 * A failing chunk is logged and recorded; the remaining chunks still run and the result is flagged
 * partial. Chunks run sequentially and are never retried. The breaker is built per call from the
 * {@code analytical-backend} configuration, so one request's failures never short-circuit another's.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchedAggregationEngine {

    static final String CIRCUIT_BREAKER = "analytical-backend";

    private final AnalyticalBackend backend;
    private final SqlRenderer renderer;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @Value("${lending.aggregation.batch-size:200}")
    private int batchSize;

    @Value("${lending.aggregation.max-query-length:100000}")
    private int maxQueryLength;

    public AggregationResult aggregate(AggregationRequest request) {
        validate(request);
        List<String> ids = dedupe(request.getIds());
        List<List<String>> restrictionChunks = restrictionChunks(request);
        if (ids.isEmpty() || restrictionChunks.isEmpty()) {
            log.debug("Nothing to aggregate: ids={} restrictionIds={}", ids.size(), request.getRestrictionIds());
            return AggregationResult.empty();
        }

        List<List<String>> idChunks = partition(ids, effectiveBatchSize());
        ChunkRun run = new ChunkRun(request, newCircuitBreaker());
        for (List<String> idChunk : idChunks) {
            for (List<String> restrictionChunk : restrictionChunks) {
                run.execute(idChunk, restrictionChunk);
            }
        }

        List<AggregateRow> rows = new ArrayList<>(run.accumulator.values());
        rows.sort(ROW_ORDER);
        AggregationResult result = AggregationResult.builder()
                .rows(rows)
                .failures(run.failures)
                .partial(!run.failures.isEmpty())
                .chunkCount(run.chunkIndex)
                .build();
        if (result.isPartial()) {
            log.warn("Aggregation completed with partial results: dimension={} ids={} chunks={} failedChunks={}",
                    request.getDimension(), ids.size(), run.chunkIndex, run.failures.size());
        } else {
            log.debug("Aggregation completed: dimension={} ids={} chunks={} rows={}",
                    request.getDimension(), ids.size(), run.chunkIndex, rows.size());
        }
        return result;
    }

    /**
     * Record and distinct-geography counts for a request, summed over the same chunking as
     * {@link #aggregate}. Chunks partition the geographies, so distinct counts add up. A failing chunk
     * raises {@link BackendChunkException}.
     */
    public AvailabilityCounts countAvailability(AggregationRequest request) {
        validate(request);
        List<String> ids = dedupe(request.getIds());
        List<List<String>> restrictionChunks = restrictionChunks(request);
        if (ids.isEmpty() || restrictionChunks.isEmpty()) {
            return AvailabilityCounts.EMPTY;
        }
        CircuitBreaker circuitBreaker = newCircuitBreaker();
        long records = 0;
        long geos = 0;
        int index = 0;
        for (List<String> idChunk : partition(ids, effectiveBatchSize())) {
            for (List<String> restrictionChunk : restrictionChunks) {
                RenderedQuery query = renderer.renderAvailability(condition(request, idChunk, restrictionChunk));
                try {
                    Supplier<AvailabilityCounts> call = CircuitBreaker.decorateSupplier(circuitBreaker,
                            () -> backend.availability(query));
                    AvailabilityCounts counts = call.get();
                    records += counts.recordCount();
                    geos += counts.geoCount();
                } catch (Exception e) {
                    throw new BackendChunkException("Availability chunk " + index + " failed", e);
                }
                index++;
            }
        }
        return new AvailabilityCounts(records, geos);
    }

    /** Fresh breaker for one call: {@code configs.analytical-backend} if registered, else the registry default. */
    CircuitBreaker newCircuitBreaker() {
        CircuitBreakerConfig config = circuitBreakerRegistry.getConfiguration(CIRCUIT_BREAKER)
                .orElseGet(circuitBreakerRegistry::getDefaultConfig);
        return CircuitBreaker.of(CIRCUIT_BREAKER, config);
    }

    private void validate(AggregationRequest request) {
        if (request.getDimension() == null) {
            throw new IllegalArgumentException("Aggregation dimension is required");
        }
        if (request.getYears() == null) {
            throw new IllegalArgumentException("Aggregation years are required");
        }
    }

    private List<List<String>> restrictionChunks(AggregationRequest request) {
        if (request.getRestrictionIds() == null) {
            return Collections.singletonList(null);
        }
        return partition(dedupe(request.getRestrictionIds()), effectiveBatchSize());
    }

    private int effectiveBatchSize() {
        if (batchSize < 1) {
            log.warn("Invalid batch size {}, using 1", batchSize);
            return 1;
        }
        return batchSize;
    }

    private Condition condition(AggregationRequest request, List<String> idChunk, List<String> restrictionChunk) {
        List<Condition> parts = new ArrayList<>();
        parts.add(Condition.in(request.getDimension().column(), idChunk));
        if (restrictionChunk != null) {
            parts.add(Condition.in(request.getDimension().other().column(), restrictionChunk));
        }
        parts.add(Condition.in(Column.ACTIVITY_YEAR, request.getYears().getYears()));
        parts.add(request.getFilters().toCondition());
        return Condition.and(parts);
    }

    /** Blank ids dropped, surrounding whitespace trimmed, first occurrence kept. */
    static List<String> dedupe(List<String> ids) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        if (ids != null) {
            for (String id : ids) {
                if (id != null && !id.isBlank()) {
                    unique.add(id.trim());
                }
            }
        }
        return new ArrayList<>(unique);
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            chunks.add(List.copyOf(items.subList(start, Math.min(items.size(), start + size))));
        }
        return chunks;
    }

    private static final Comparator<Object> KEY_VALUE_ORDER =
            Comparator.nullsLast(Comparator.comparing(Object::toString));

    private static final Comparator<AggregateRow> ROW_ORDER = (a, b) -> {
        List<Object> left = a.identity();
        List<Object> right = b.identity();
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int c = KEY_VALUE_ORDER.compare(left.get(i), right.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(left.size(), right.size());
    };

    /** State of one {@link #aggregate} call. */
    private final class ChunkRun {
        private final AggregationRequest request;
        private final CircuitBreaker circuitBreaker;
        private final Map<List<Object>, AggregateRow> accumulator = new HashMap<>();
        private final List<ChunkFailure> failures = new ArrayList<>();
        private int chunkIndex;

        ChunkRun(AggregationRequest request, CircuitBreaker circuitBreaker) {
            this.request = request;
            this.circuitBreaker = circuitBreaker;
        }

        void execute(List<String> idChunk, List<String> restrictionChunk) {
            AggregationQuery query = AggregationQuery.builder()
                    .groupKeys(request.getGroupKeys())
                    .where(condition(request, idChunk, restrictionChunk))
                    .build();
            RenderedQuery rendered = renderer.render(query);
            if (rendered.expandedLength() > maxQueryLength) {
                if (idChunk.size() > 1) {
                    log.debug("Query length {} over limit {}, splitting chunk of {} ids",
                            rendered.expandedLength(), maxQueryLength, idChunk.size());
                    int half = idChunk.size() / 2;
                    execute(idChunk.subList(0, half), restrictionChunk);
                    execute(idChunk.subList(half, idChunk.size()), restrictionChunk);
                    return;
                }
                if (restrictionChunk != null && restrictionChunk.size() > 1) {
                    int half = restrictionChunk.size() / 2;
                    execute(idChunk, restrictionChunk.subList(0, half));
                    execute(idChunk, restrictionChunk.subList(half, restrictionChunk.size()));
                    return;
                }
                log.warn("Query length {} over limit {} for a single-id chunk, running anyway",
                        rendered.expandedLength(), maxQueryLength);
            }

            int index = chunkIndex++;
            int restrictionCount = restrictionChunk != null ? restrictionChunk.size() : 0;
            List<AggregateRow> buffered;
            try {
                Supplier<List<AggregateRow>> call = CircuitBreaker.decorateSupplier(circuitBreaker,
                        () -> backend.aggregate(rendered, request.getGroupKeys()));
                buffered = call.get();
            } catch (CallNotPermittedException e) {
                log.warn("Circuit open, skipping chunk {} ({} ids, {} restriction ids)",
                        index, idChunk.size(), restrictionCount);
                failures.add(new ChunkFailure(index, idChunk.size(), restrictionCount, "circuit open: " + e.getMessage()));
                return;
            } catch (Exception e) {
                BackendChunkException failure = new BackendChunkException(
                        "Chunk " + index + " failed (" + idChunk.size() + " ids, " + restrictionCount + " restriction ids)", e);
                log.error("Aggregation chunk failed: dimension={} chunk={} firstId={}",
                        request.getDimension(), index, idChunk.get(0), failure);
                failures.add(new ChunkFailure(index, idChunk.size(), restrictionCount, String.valueOf(e.getMessage())));
                return;
            }
            for (AggregateRow row : buffered) {
                accumulator.merge(row.identity(), row, AggregateRow::plus);
            }
            log.debug("Chunk {} merged: {} ids, {} rows", index, idChunk.size(), buffered.size());
        }
    }
}
