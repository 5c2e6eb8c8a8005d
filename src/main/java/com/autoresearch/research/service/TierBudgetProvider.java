package com.autoresearch.research.service;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.Tier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Budgets from configuration: the tier comes from the configured user map, the limits from the mode.
 */
@Component
@RequiredArgsConstructor
public class TierBudgetProvider implements BudgetProvider {

    private final ResearchProperties properties;

    @Override
    public Tier tierFor(String userId) {
        return properties.getTiers().tierFor(userId);
    }

    @Override
    public Budget resolveBudget(String userId, ResearchMode mode) {
        Tier tier = tierFor(userId);
        ResearchProperties.ModeSettings settings = properties.getModeSettings(mode);
        return new Budget(tier, mode, settings.getMaxSources(), settings.getMaxWords(), settings.getMaxIterations(),
                settings.getMaxWallTime(), settings.getMinCorroboration(), settings.getResultsPerQuery(),
                tier.isPremium());
    }

    @Override
    public List<ResearchMode> availableModes(Tier tier) {
        return Arrays.stream(ResearchMode.values())
                .filter(mode -> tier.isPremium() || !properties.getModeSettings(mode).isPremiumOnly())
                .toList();
    }
}
