package com.autoresearch.research.model;

import java.time.Duration;

/**
 * Resource limits of one research run, derived from tier and mode when the run starts.
 */
public record Budget(
        Tier tier,
        ResearchMode mode,
        int maxSources,
        int maxWords,
        int maxIterations,
        Duration maxWallTime,
        int minCorroboration,
        int resultsPerQuery,
        boolean premiumFeaturesEnabled
) {
    public Budget {
        if (maxSources < 1) {
            throw new IllegalArgumentException("maxSources must be positive");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (maxWallTime == null || maxWallTime.isNegative() || maxWallTime.isZero()) {
            throw new IllegalArgumentException("maxWallTime must be positive");
        }
        minCorroboration = Math.max(1, minCorroboration);
        resultsPerQuery = Math.max(1, resultsPerQuery);
    }

    public Budget withMaxIterations(int iterations) {
        return new Budget(tier, mode, maxSources, maxWords, iterations, maxWallTime, minCorroboration,
                resultsPerQuery, premiumFeaturesEnabled);
    }
}
