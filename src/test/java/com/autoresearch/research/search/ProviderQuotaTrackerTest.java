package com.autoresearch.research.search;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.support.MutableClock;
import com.autoresearch.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderQuotaTrackerTest {

    private MutableClock clock;
    private ProviderQuotaTracker tracker;

    @BeforeEach
    void setUp() {
        ResearchProperties properties = new ResearchProperties();
        ResearchProperties.ProviderSettings serpapi = new ResearchProperties.ProviderSettings();
        serpapi.setQuotaLimit(2);
        serpapi.setQuotaWindow(Duration.ofDays(1));
        properties.setProviders(Map.of("serpapi", serpapi));
        clock = new MutableClock(TestData.NOW);
        tracker = new ProviderQuotaTracker(properties, clock);
    }

    @Test
    void testLimitWithinWindow() {
        assertTrue(tracker.tryAcquire("serpapi"));
        assertTrue(tracker.tryAcquire("serpapi"));
        assertFalse(tracker.tryAcquire("serpapi"));
        assertTrue(tracker.isExhausted("serpapi"));
        assertEquals(2, tracker.usage().get("serpapi"));
    }

    @Test
    void testWindowRollsOver() {
        tracker.tryAcquire("serpapi");
        tracker.tryAcquire("serpapi");
        clock.advance(Duration.ofDays(1));
        assertTrue(tracker.tryAcquire("serpapi"));
        assertFalse(tracker.isExhausted("serpapi"));
    }

    @Test
    void testUnlimitedProviderNeverThrottled() {
        for (int i = 0; i < 100; i++) {
            assertTrue(tracker.tryAcquire("wikipedia"));
        }
        assertFalse(tracker.isExhausted("wikipedia"));
    }

    @Test
    void testMarkExhaustedUntilWindowEnds() {
        tracker.markExhausted("serpapi");
        assertTrue(tracker.isExhausted("serpapi"));
        assertFalse(tracker.tryAcquire("serpapi"));
        clock.advance(Duration.ofDays(2));
        assertFalse(tracker.isExhausted("serpapi"));
    }
}
