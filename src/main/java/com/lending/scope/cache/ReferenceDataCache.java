package com.lending.scope.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * In-process cache for slow-changing reference data (metro membership and names). Each entry
 * carries its own time-to-live. Constructed once at start-up and injected where needed.
 */
@Slf4j
public class ReferenceDataCache {

    private final Cache<String, Entry> cache;

    public ReferenceDataCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public ReferenceDataCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .build();
    }

    /**
     * Returns the cached value for {@code key}, loading and caching it for {@code ttl} when absent or
     * expired. Concurrent callers for the same key wait for a single load. The loader must not return null.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrLoad(String key, Supplier<T> loader, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        Entry entry = cache.get(key, k -> {
            log.debug("Reference cache miss for key={}, loading (ttl={})", k, ttl);
            T value = Objects.requireNonNull(loader.get(), () -> "Loader returned null for key " + k);
            return new Entry(value, ttl);
        });
        return (T) entry.value;
    }

    public void invalidate(String key) {
        cache.invalidate(key);
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static final class Entry {
        private final Object value;
        private final Duration ttl;

        private Entry(Object value, Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }
    }

    private static final class PerEntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttl.toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttl.toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
