package com.autoresearch.research.cache;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.text.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Query cache with exact and near-duplicate lookup. Entries are isolated per research mode and never served past
 * expiry; expired entries are evicted lazily on lookup and store, and by a periodic sweep.
 */
@Service
@Slf4j
public class SimilarityCache {

    private final CacheStore store;
    private final QueryFingerprinter fingerprinter;
    private final ResearchProperties properties;
    private final Clock clock;

    private final AtomicLong exactHits = new AtomicLong();
    private final AtomicLong similarHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong stores = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public SimilarityCache(CacheStore store, QueryFingerprinter fingerprinter, ResearchProperties properties,
                           Clock clock) {
        this.store = store;
        this.fingerprinter = fingerprinter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * A store that cannot be read counts as a miss.
     */
    public Optional<CacheHit> lookup(String queryText, ResearchMode mode) {
        try {
            return find(queryText, mode);
        } catch (DataAccessException ex) {
            misses.incrementAndGet();
            log.warn("Cache lookup for '{}' ({}) failed, treating as a miss: {}", queryText, mode, ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<CacheHit> find(String queryText, ResearchMode mode) {
        Instant now = clock.instant();
        Fingerprint fingerprint = fingerprinter.fingerprint(queryText, mode);

        Optional<CacheEntry> exact = store.find(fingerprint.value());
        if (exact.isPresent()) {
            CacheEntry entry = exact.get();
            if (entry.isExpired(now)) {
                evict(entry, now);
            } else if (entry.mode() == mode) {
                exactHits.incrementAndGet();
                log.debug("Exact cache hit for '{}' ({}).", queryText, mode);
                return Optional.of(new CacheHit(entry, 1.0, true));
            }
        }

        double threshold = properties.getCache().getSimilarityThreshold();
        CacheHit best = null;
        for (CacheEntry candidate : store.recent(mode, properties.getCache().getRecentWindow())) {
            if (candidate.isExpired(now)) {
                evict(candidate, now);
                continue;
            }
            if (candidate.mode() != mode) {
                continue;
            }
            double similarity = Tokenizer.jaccard(fingerprint.tokens(), candidate.tokens());
            if (similarity < threshold) {
                continue;
            }
            CacheHit hit = new CacheHit(candidate, similarity, false);
            if (best == null || BEST_FIRST.compare(hit, best) < 0) {
                best = hit;
            }
        }
        if (best != null) {
            similarHits.incrementAndGet();
            log.info("Similar cache hit for '{}' ({}): {}% similar to '{}'.", queryText, mode,
                    best.similarityPercent(), best.entry().queryText());
            return Optional.of(best);
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    /**
     * Last writer wins when two runs populate the same fingerprint. A write the store rejects, such as the loser of
     * two concurrent inserts, is logged and dropped.
     *
     * @return whether the entry was written
     */
    public boolean store(String queryText, ResearchMode mode, CachedResultSet resultSet) {
        Instant now = clock.instant();
        Fingerprint fingerprint = fingerprinter.fingerprint(queryText, mode);
        CacheEntry entry = new CacheEntry(fingerprint.value(), queryText, fingerprint.tokens(), mode, resultSet, now,
                now.plus(properties.getCache().getTtl()));
        try {
            sweep(now);
            store.save(entry);
        } catch (DataAccessException ex) {
            log.warn("Could not cache result set for '{}' ({}): {}", queryText, mode, ex.getMessage());
            return false;
        }
        long total = stores.incrementAndGet();
        log.debug("Cached result set for '{}' ({}). Total stores={}.", queryText, mode, total);
        return true;
    }

    public CacheStats stats() {
        return new CacheStats(store.size(), exactHits.get(), similarHits.get(), misses.get(), stores.get(),
                evictions.get());
    }

    public int clearExpired() {
        return sweep(clock.instant());
    }

    public int clearAll() {
        int removed = store.clear();
        log.info("Cleared {} cache entries.", removed);
        return removed;
    }

    @Scheduled(fixedDelayString = "${research.cache.sweep-interval:PT10M}",
            initialDelayString = "${research.cache.sweep-interval:PT10M}")
    public void scheduledSweep() {
        int removed = clearExpired();
        if (removed > 0) {
            log.info("Cache sweep removed {} expired entries.", removed);
        }
    }

    private int sweep(Instant now) {
        int removed = store.removeExpired(now);
        evictions.addAndGet(removed);
        return removed;
    }

    private void evict(CacheEntry expired, Instant now) {
        if (store.removeIfExpired(expired.fingerprint(), now)) {
            evictions.incrementAndGet();
        }
    }

    private static final Comparator<CacheHit> BEST_FIRST = Comparator
            .comparingDouble(CacheHit::similarity).reversed()
            .thenComparing((CacheHit hit) -> hit.entry().createdAt(), Comparator.reverseOrder());
}
