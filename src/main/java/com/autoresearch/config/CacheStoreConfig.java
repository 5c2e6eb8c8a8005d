package com.autoresearch.config;

import com.autoresearch.repository.CacheEntryRecordRepository;
import com.autoresearch.research.cache.CacheStore;
import com.autoresearch.research.cache.InMemoryCacheStore;
import com.autoresearch.research.cache.JpaCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the cache backend from {@code research.cache.store}: {@code memory} (default) or {@code jpa}.
 */
@Configuration
public class CacheStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "research.cache", name = "store", havingValue = "memory", matchIfMissing = true)
    public CacheStore inMemoryCacheStore(ResearchProperties properties) {
        return new InMemoryCacheStore(properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "research.cache", name = "store", havingValue = "jpa")
    public CacheStore jpaCacheStore(CacheEntryRecordRepository repository, ObjectMapper objectMapper) {
        return new JpaCacheStore(repository, objectMapper);
    }
}
