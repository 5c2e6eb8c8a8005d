package com.autoresearch.research.cache;

import com.autoresearch.research.model.ResearchMode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed backing store behind {@link SimilarityCache}. Implementations must tolerate concurrent calls; a save for an
 * existing fingerprint replaces it.
 */
public interface CacheStore {

    Optional<CacheEntry> find(String fingerprint);

    /**
     * Most recently stored entries of the given mode, newest first.
     */
    List<CacheEntry> recent(ResearchMode mode, int limit);

    void save(CacheEntry entry);

    /**
     * Removes the entry under {@code fingerprint} only while it is still expired at {@code now}, so an entry written
     * concurrently under the same fingerprint survives.
     */
    boolean removeIfExpired(String fingerprint, Instant now);

    int removeExpired(Instant now);

    int clear();

    long size();
}
