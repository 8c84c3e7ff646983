package com.mathrok.engine.cache;

public record CacheStats(
        long hits,
        long misses,
        int size
) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0 : (double) hits / total;
    }
}
