package com.autoresearch.research.cache;

import com.autoresearch.research.model.ResearchMode;

import java.time.Instant;
import java.util.Set;

public record CacheEntry(
        String fingerprint,
        String queryText,
        Set<String> tokens,
        ResearchMode mode,
        CachedResultSet resultSet,
        Instant createdAt,
        Instant expiresAt
) {
    public CacheEntry {
        tokens = Set.copyOf(tokens);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
