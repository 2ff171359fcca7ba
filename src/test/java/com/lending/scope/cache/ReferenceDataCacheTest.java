package com.lending.scope.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ReferenceDataCache: get-or-load with per-entry TTL.
 */
class ReferenceDataCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private ReferenceDataCache cache;

    @BeforeEach
    void setUp() {
        Ticker ticker = nanos::get;
        cache = new ReferenceDataCache(100, ticker);
    }

    @Test
    void loadsOnceWithinTtl() {
        AtomicInteger loads = new AtomicInteger();

        String first = cache.getOrLoad("k", () -> "v" + loads.incrementAndGet(), Duration.ofMinutes(5));
        String second = cache.getOrLoad("k", () -> "v" + loads.incrementAndGet(), Duration.ofMinutes(5));

        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(loads).hasValue(1);
    }

    @Test
    void reloadsAfterEntryTtlExpires() {
        AtomicInteger loads = new AtomicInteger();
        cache.getOrLoad("short", () -> loads.incrementAndGet(), Duration.ofSeconds(10));
        cache.getOrLoad("long", () -> loads.incrementAndGet(), Duration.ofHours(1));

        nanos.addAndGet(Duration.ofSeconds(11).toNanos());

        Integer shortValue = cache.getOrLoad("short", () -> loads.incrementAndGet(), Duration.ofSeconds(10));
        Integer longValue = cache.getOrLoad("long", () -> loads.incrementAndGet(), Duration.ofHours(1));

        assertThat(shortValue).isEqualTo(3);
        assertThat(longValue).isEqualTo(2);
    }

    @Test
    void invalidateForcesReload() {
        cache.getOrLoad("k", () -> "old", Duration.ofMinutes(5));
        cache.invalidate("k");

        assertThat(cache.<String>getOrLoad("k", () -> "new", Duration.ofMinutes(5))).isEqualTo("new");
    }

    @Test
    void nullFromLoaderIsRejected() {
        assertThatThrownBy(() -> cache.getOrLoad("k", () -> null, Duration.ofMinutes(5)))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("k");
        assertThat(cache.size()).isZero();
    }
}
