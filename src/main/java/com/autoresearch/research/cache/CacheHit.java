package com.autoresearch.research.cache;

/**
 * A served cache entry. {@code exact} is false for near-duplicate hits, which callers must disclose.
 */
public record CacheHit(
        CacheEntry entry,
        double similarity,
        boolean exact
) {
    public int similarityPercent() {
        return (int) Math.round(similarity * 100);
    }
}
