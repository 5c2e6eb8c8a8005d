package com.autoresearch.research.cache;

public record CacheStats(
        long entries,
        long exactHits,
        long similarHits,
        long misses,
        long stores,
        long evictions
) {
    public double hitRate() {
        long lookups = exactHits + similarHits + misses;
        return lookups == 0 ? 0.0 : (double) (exactHits + similarHits) / lookups;
    }
}
