package com.autoresearch.research.cache;

import com.autoresearch.entity.CacheEntryRecord;
import com.autoresearch.repository.CacheEntryRecordRepository;
import com.autoresearch.research.model.ResearchMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Cache entries persisted through JPA, result sets stored as JSON. An unreadable row is treated as absent and is
 * replaced by the next store for the same fingerprint.
 */
@Slf4j
public class JpaCacheStore implements CacheStore {

    private final CacheEntryRecordRepository repository;
    private final ObjectMapper objectMapper;

    public JpaCacheStore(CacheEntryRecordRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CacheEntry> find(String fingerprint) {
        return repository.findById(fingerprint).map(this::toEntry);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CacheEntry> recent(ResearchMode mode, int limit) {
        return repository.findByModeOrderByCreatedAtDesc(mode, PageRequest.of(0, Math.max(1, limit))).stream()
                .map(this::toEntry)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    @Transactional
    public void save(CacheEntry entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry.resultSet());
        } catch (JsonProcessingException ex) {
            log.warn("Skipping cache persistence for {}: {}", entry.fingerprint(), ex.getOriginalMessage());
            return;
        }
        repository.save(CacheEntryRecord.builder()
                .fingerprint(entry.fingerprint())
                .queryText(entry.queryText())
                .tokens(String.join(" ", entry.tokens()))
                .mode(entry.mode())
                .resultJson(json)
                .createdAt(entry.createdAt())
                .expiresAt(entry.expiresAt())
                .build());
    }

    @Override
    @Transactional
    public boolean removeIfExpired(String fingerprint, Instant now) {
        return repository.deleteIfExpired(fingerprint, now) > 0;
    }

    @Override
    @Transactional
    public int removeExpired(Instant now) {
        return repository.deleteExpired(now);
    }

    @Override
    @Transactional
    public int clear() {
        int size = (int) repository.count();
        repository.deleteAllInBatch();
        return size;
    }

    @Override
    public long size() {
        return repository.count();
    }

    private CacheEntry toEntry(CacheEntryRecord record) {
        try {
            CachedResultSet resultSet = objectMapper.readValue(record.getResultJson(), CachedResultSet.class);
            Set<String> tokens = new LinkedHashSet<>(Arrays.asList(record.getTokens().split(" ")));
            tokens.remove("");
            return new CacheEntry(record.getFingerprint(), record.getQueryText(), tokens, record.getMode(), resultSet,
                    record.getCreatedAt(), record.getExpiresAt());
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable cache entry {}: {}", record.getFingerprint(), ex.getOriginalMessage());
            return null;
        }
    }
}
