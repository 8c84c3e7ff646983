package com.mathrok.engine.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Advisory store for computed results. A miss must never change what the caller computes.
 */
public interface ResultCache {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value, Duration ttl);

    void clear();

    CacheStats stats();
}
