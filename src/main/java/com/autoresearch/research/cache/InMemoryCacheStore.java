package com.autoresearch.research.cache;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.ResearchMode;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCacheStore implements CacheStore {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Deque<String> recentFingerprints = new ArrayDeque<>();
    private final ResearchProperties properties;

    public InMemoryCacheStore(ResearchProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<CacheEntry> find(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public List<CacheEntry> recent(ResearchMode mode, int limit) {
        List<CacheEntry> result = new ArrayList<>();
        synchronized (recentFingerprints) {
            for (String fingerprint : recentFingerprints) {
                if (result.size() >= limit) {
                    break;
                }
                CacheEntry entry = entries.get(fingerprint);
                if (entry != null && entry.mode() == mode) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    @Override
    public void save(CacheEntry entry) {
        entries.put(entry.fingerprint(), entry);
        synchronized (recentFingerprints) {
            recentFingerprints.remove(entry.fingerprint());
            recentFingerprints.addFirst(entry.fingerprint());
            int window = Math.max(1, properties.getCache().getRecentWindow());
            while (recentFingerprints.size() > window) {
                recentFingerprints.removeLast();
            }
        }
    }

    @Override
    public boolean removeIfExpired(String fingerprint, Instant now) {
        CacheEntry current = entries.get(fingerprint);
        if (current == null || !current.isExpired(now) || !entries.remove(fingerprint, current)) {
            return false;
        }
        synchronized (recentFingerprints) {
            if (!entries.containsKey(fingerprint)) {
                recentFingerprints.remove(fingerprint);
            }
        }
        return true;
    }

    @Override
    public int removeExpired(Instant now) {
        int removed = 0;
        Iterator<CacheEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            CacheEntry entry = iterator.next();
            if (entry.isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            synchronized (recentFingerprints) {
                recentFingerprints.removeIf(fingerprint -> !entries.containsKey(fingerprint));
            }
        }
        return removed;
    }

    @Override
    public int clear() {
        int size = entries.size();
        entries.clear();
        synchronized (recentFingerprints) {
            recentFingerprints.clear();
        }
        return size;
    }

    @Override
    public long size() {
        return entries.size();
    }
}
