package com.mathrok.engine.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ResultCache} backed by a concurrent map. Entries expire after their TTL; when the cache is full
 * the entry stored longest ago is evicted.
 */
public class InMemoryResultCache implements ResultCache {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryResultCache.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final int maxEntries;
    private final Clock clock;

    public InMemoryResultCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public InMemoryResultCache(int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = entries.get(key);
        Instant now = clock.instant();
        if (entry == null || !type.isInstance(entry.value())) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (!entry.expiresAt().isAfter(now)) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(type.cast(entry.value()));
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        Instant now = clock.instant();
        if (!entries.containsKey(key) && entries.size() >= maxEntries) {
            evictExpired(now);
            if (entries.size() >= maxEntries) {
                evictOldest();
            }
        }
        entries.put(key, new Entry(value, now, now.plus(ttl)));
    }

    @Override
    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), entries.size());
    }

    private void evictExpired(Instant now) {
        entries.entrySet().removeIf(e -> !e.getValue().expiresAt().isAfter(now));
    }

    private void evictOldest() {
        entries.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().storedAt()))
                .ifPresent(oldest -> {
                    entries.remove(oldest.getKey(), oldest.getValue());
                    logger.debug("Evicted cache entry {}", oldest.getKey());
                });
    }

    private record Entry(Object value, Instant storedAt, Instant expiresAt) {
    }
}
