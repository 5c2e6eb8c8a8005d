package com.autoresearch.research.cache;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.RunStatus;
import com.autoresearch.research.model.WorkingSetSnapshot;
import com.autoresearch.support.MutableClock;
import com.autoresearch.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SimilarityCacheTest {

    private MutableClock clock;
    private ResearchProperties properties;
    private SimilarityCache cache;

    @BeforeEach
    void setUp() {
        properties = new ResearchProperties();
        properties.getCache().setTtl(Duration.ofHours(24));
        clock = new MutableClock(TestData.NOW);
        cache = new SimilarityCache(new InMemoryCacheStore(properties), new QueryFingerprinter(), properties, clock);
    }

    @Test
    void testExactHitForRewordedQuery() {
        cache.store("What are the health benefits of green tea?", ResearchMode.STANDARD, resultSet("green tea"));

        Optional<CacheHit> hit = cache.lookup("Green tea health benefits", ResearchMode.STANDARD);

        assertTrue(hit.isPresent());
        assertTrue(hit.get().exact());
        assertEquals(100, hit.get().similarityPercent());
        assertEquals(1, cache.stats().exactHits());
    }

    @Test
    void testSimilarHitAboveThreshold() {
        cache.store("long term health benefits of green tea drinking", ResearchMode.STANDARD,
                resultSet("green tea"));

        Optional<CacheHit> hit = cache.lookup("long term health benefits green tea drinking habits",
                ResearchMode.STANDARD);

        assertTrue(hit.isPresent());
        assertFalse(hit.get().exact());
        assertEquals(0.875, hit.get().similarity(), 1e-9);
        assertEquals(88, hit.get().similarityPercent());
        assertEquals(1, cache.stats().similarHits());
    }

    @Test
    void testBelowThresholdIsMiss() {
        cache.store("health benefits of green tea", ResearchMode.STANDARD, resultSet("green tea"));

        assertTrue(cache.lookup("health benefits of green tea extract", ResearchMode.STANDARD).isEmpty());
        assertEquals(1, cache.stats().misses());
    }

    @Test
    void testModesAreIsolated() {
        cache.store("quantum computing basics", ResearchMode.QUICK, resultSet("quantum"));

        assertTrue(cache.lookup("quantum computing basics", ResearchMode.STANDARD).isEmpty());
        assertTrue(cache.lookup("quantum computing basics", ResearchMode.QUICK).isPresent());
    }

    @Test
    void testExpiredEntryIsNeverServed() {
        cache.store("quantum computing basics", ResearchMode.QUICK, resultSet("quantum"));
        clock.advance(Duration.ofHours(25));

        assertTrue(cache.lookup("quantum computing basics", ResearchMode.QUICK).isEmpty());
        CacheStats stats = cache.stats();
        assertEquals(0, stats.entries());
        assertEquals(1, stats.evictions());
    }

    @Test
    void testLastWriterWins() {
        cache.store("quantum computing basics", ResearchMode.QUICK, resultSet("first"));
        cache.store("basics of quantum computing", ResearchMode.QUICK, resultSet("second"));

        CacheHit hit = cache.lookup("quantum computing basics", ResearchMode.QUICK).orElseThrow();
        assertEquals("second", hit.entry().resultSet().query().rawText());
        assertEquals(1, cache.stats().entries());
    }

    @Test
    void testClearExpiredAndClearAll() {
        cache.store("quantum computing basics", ResearchMode.QUICK, resultSet("quantum"));
        clock.advance(Duration.ofHours(12));
        cache.store("green tea", ResearchMode.QUICK, resultSet("green tea"));
        clock.advance(Duration.ofHours(13));

        assertEquals(1, cache.clearExpired());
        assertEquals(1, cache.clearAll());
        assertEquals(0, cache.stats().entries());
    }

    @Test
    void testQueriesWithoutContentTokensDoNotMatchEachOther() {
        cache.store("What is it?", ResearchMode.STANDARD, resultSet("what is it"));

        assertTrue(cache.lookup("Why should I?", ResearchMode.STANDARD).isEmpty());
        assertTrue(cache.lookup("What is it?", ResearchMode.STANDARD).orElseThrow().exact());
    }

    @Test
    void testRejectedWriteIsLoggedNotThrown() {
        CacheStore failing = mock(CacheStore.class);
        doThrow(new DataIntegrityViolationException("duplicate key research_cache_entry"))
                .when(failing).save(any(CacheEntry.class));
        SimilarityCache failingCache = new SimilarityCache(failing, new QueryFingerprinter(), properties, clock);

        boolean stored = failingCache.store("quantum computing basics", ResearchMode.QUICK, resultSet("quantum"));

        assertFalse(stored);
        assertEquals(0, failingCache.stats().stores());
    }

    @Test
    void testUnreadableStoreIsAMiss() {
        CacheStore failing = mock(CacheStore.class);
        when(failing.find(anyString())).thenThrow(new DataAccessResourceFailureException("connection refused"));
        SimilarityCache failingCache = new SimilarityCache(failing, new QueryFingerprinter(), properties, clock);

        assertTrue(failingCache.lookup("quantum computing basics", ResearchMode.QUICK).isEmpty());
        assertEquals(1, failingCache.stats().misses());
    }

    @Test
    void testExpiredEntryReplacedConcurrentlyIsNotCounted() {
        CacheStore racing = mock(CacheStore.class);
        CacheEntry expired = new CacheEntry("fp", "quantum computing basics", Set.of("quantum"),
                ResearchMode.QUICK, resultSet("quantum"), TestData.NOW.minus(Duration.ofHours(30)),
                TestData.NOW.minus(Duration.ofHours(6)));
        when(racing.find(anyString())).thenReturn(Optional.of(expired));
        when(racing.recent(any(ResearchMode.class), anyInt())).thenReturn(List.of());
        when(racing.removeIfExpired(any(), any())).thenReturn(false);
        SimilarityCache racingCache = new SimilarityCache(racing, new QueryFingerprinter(), properties, clock);

        assertTrue(racingCache.lookup("quantum computing basics", ResearchMode.QUICK).isEmpty());
        assertEquals(0, racingCache.stats().evictions());
    }

    private static CachedResultSet resultSet(String label) {
        return new CachedResultSet(TestData.query(label), WorkingSetSnapshot.empty(), List.of(), RunStatus.SUFFICIENT);
    }
}
