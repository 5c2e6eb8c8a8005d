package com.autoresearch.research.cache;

import com.autoresearch.repository.CacheEntryRecordRepository;
import com.autoresearch.research.model.Claim;
import com.autoresearch.research.model.CoverageStat;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.RunStatus;
import com.autoresearch.research.model.SubTopic;
import com.autoresearch.research.model.WorkingSetSnapshot;
import com.autoresearch.support.TestData;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class JpaCacheStoreTest {

    @Autowired
    private CacheEntryRecordRepository repository;

    private JpaCacheStore store;

    @BeforeEach
    void setUp() {
        store = new JpaCacheStore(repository, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void testSaveAndFind() {
        store.save(entry("abc", ResearchMode.STANDARD, Duration.ZERO));

        Optional<CacheEntry> found = store.find("abc");

        assertTrue(found.isPresent());
        CacheEntry entry = found.get();
        assertEquals(Set.of("green", "tea"), entry.tokens());
        assertEquals(ResearchMode.STANDARD, entry.mode());
        CachedResultSet resultSet = entry.resultSet();
        assertEquals(RunStatus.PARTIAL, resultSet.status());
        assertEquals(1, resultSet.workingSet().size());
        assertEquals("https://example.org/tea", resultSet.workingSet().sources().get(0).url());
        assertEquals(1, resultSet.claims().size());
        assertEquals("benefits", resultSet.query().subTopics().get(0).label());
    }

    @Test
    void testRecentIsPerModeNewestFirst() {
        store.save(entry("old", ResearchMode.STANDARD, Duration.ZERO));
        store.save(entry("new", ResearchMode.STANDARD, Duration.ofMinutes(5)));
        store.save(entry("quick", ResearchMode.QUICK, Duration.ofMinutes(10)));

        List<CacheEntry> recent = store.recent(ResearchMode.STANDARD, 10);

        assertEquals(List.of("new", "old"), recent.stream().map(CacheEntry::fingerprint).toList());
    }

    @Test
    void testRemoveExpired() {
        store.save(entry("old", ResearchMode.STANDARD, Duration.ZERO));
        store.save(entry("new", ResearchMode.STANDARD, Duration.ofHours(2)));

        int removed = store.removeExpired(TestData.NOW.plus(Duration.ofHours(1)).plusSeconds(1));

        assertEquals(1, removed);
        assertTrue(store.find("old").isEmpty());
        assertEquals(1, store.size());
    }

    @Test
    void testRemoveIfExpiredOnlyRemovesStaleRow() {
        store.save(entry("fresh", ResearchMode.STANDARD, Duration.ofHours(2)));
        store.save(entry("stale", ResearchMode.STANDARD, Duration.ZERO));
        Instant now = TestData.NOW.plus(Duration.ofHours(1)).plusSeconds(1);

        assertFalse(store.removeIfExpired("fresh", now));
        assertTrue(store.removeIfExpired("stale", now));
        assertTrue(store.find("fresh").isPresent());
        assertTrue(store.find("stale").isEmpty());
    }

    @Test
    void testClear() {
        store.save(entry("a", ResearchMode.STANDARD, Duration.ZERO));
        store.save(entry("b", ResearchMode.QUICK, Duration.ZERO));

        assertEquals(2, store.clear());
        assertEquals(0, store.size());
    }

    private static CacheEntry entry(String fingerprint, ResearchMode mode, Duration offset) {
        SubTopic topic = new SubTopic("benefits", List.of("benefit"));
        WorkingSetSnapshot snapshot = new WorkingSetSnapshot(
                List.of(TestData.source("brave", "https://example.org/tea", "Green tea", "Green tea benefits", 70,
                        0.8)),
                Map.of("benefits", new CoverageStat("benefits", 1, 72.0)));
        CachedResultSet resultSet = new CachedResultSet(TestData.query("green tea", topic), snapshot,
                List.of(new Claim("benefits", "Green tea has benefits.", List.of("https://example.org/tea"), 35.0)),
                RunStatus.PARTIAL);
        return new CacheEntry(fingerprint, "green tea", Set.of("green", "tea"), mode, resultSet,
                TestData.NOW.plus(offset), TestData.NOW.plus(offset).plus(Duration.ofHours(1)));
    }
}
