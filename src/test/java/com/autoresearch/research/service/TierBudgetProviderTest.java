package com.autoresearch.research.service;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TierBudgetProviderTest {

    private TierBudgetProvider provider;

    @BeforeEach
    void setUp() {
        ResearchProperties properties = new ResearchProperties();
        properties.getTiers().setUsers(Map.of("alice", Tier.PREMIUM));
        provider = new TierBudgetProvider(properties);
    }

    @Test
    void testTierFromUserMapWithDefault() {
        assertEquals(Tier.PREMIUM, provider.tierFor("alice"));
        assertEquals(Tier.FREE, provider.tierFor("bob"));
        assertEquals(Tier.FREE, provider.tierFor(null));
    }

    @Test
    void testBudgetFollowsModeSettings() {
        Budget budget = provider.resolveBudget("bob", ResearchMode.STANDARD);

        assertEquals(Tier.FREE, budget.tier());
        assertEquals(5, budget.maxSources());
        assertEquals(2000, budget.maxWords());
        assertEquals(3, budget.maxIterations());
        assertEquals(Duration.ofMinutes(3), budget.maxWallTime());
        assertEquals(2, budget.minCorroboration());
        assertFalse(budget.premiumFeaturesEnabled());
    }

    @Test
    void testPremiumFeaturesFollowTier() {
        assertTrue(provider.resolveBudget("alice", ResearchMode.QUICK).premiumFeaturesEnabled());
    }

    @Test
    void testPremiumOnlyModesHiddenFromFreeTier() {
        assertEquals(List.of(ResearchMode.QUICK, ResearchMode.STANDARD), provider.availableModes(Tier.FREE));
        assertEquals(List.of(ResearchMode.QUICK, ResearchMode.STANDARD, ResearchMode.DEEP),
                provider.availableModes(Tier.PREMIUM));
    }
}
