package com.autoresearch.research.search;

import com.autoresearch.research.model.Tier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
@Slf4j
public class ProviderRegistry {

    private final List<SearchProvider> providers;

    public ProviderRegistry(List<SearchProvider> providers) {
        this.providers = providers.stream()
                .sorted(Comparator.comparingInt(SearchProvider::priority).thenComparing(SearchProvider::name))
                .toList();
        log.info("Registered search providers: {}", this.providers.stream()
                .map(provider -> provider.name() + (provider.isAvailable() ? "" : " (unavailable)"))
                .toList());
    }

    public List<SearchProvider> eligible(Tier tier) {
        return providers.stream()
                .filter(SearchProvider::isAvailable)
                .filter(provider -> !provider.premiumOnly() || tier.isPremium())
                .toList();
    }

    /**
     * Eligible providers grouped by priority, highest priority (lowest number) first. Order within a group is by
     * name.
     */
    public List<List<SearchProvider>> prioritySubsets(Tier tier) {
        Map<Integer, List<SearchProvider>> grouped = new TreeMap<>();
        for (SearchProvider provider : eligible(tier)) {
            grouped.computeIfAbsent(provider.priority(), key -> new ArrayList<>()).add(provider);
        }
        return grouped.values().stream().map(List::copyOf).toList();
    }

    public List<SearchProvider> all() {
        return providers;
    }
}
