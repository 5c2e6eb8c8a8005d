package com.autoresearch.api;

import com.autoresearch.research.cache.CacheStats;
import com.autoresearch.research.cache.SimilarityCache;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/cache")
public class CacheController {

    private final SimilarityCache similarityCache;

    public CacheController(SimilarityCache similarityCache) {
        this.similarityCache = similarityCache;
    }

    @GetMapping("/stats")
    public CacheStats stats() {
        return similarityCache.stats();
    }

    @DeleteMapping("/expired")
    public Map<String, Integer> clearExpired() {
        return Map.of("removed", similarityCache.clearExpired());
    }

    @DeleteMapping
    public Map<String, Integer> clearAll() {
        return Map.of("removed", similarityCache.clearAll());
    }
}
