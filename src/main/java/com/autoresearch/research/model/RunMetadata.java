package com.autoresearch.research.model;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;

public record RunMetadata(
        Tier tier,
        ResearchMode mode,
        boolean fromCache,
        @Nullable Double cacheSimilarity,
        int iterations,
        Duration elapsed,
        int providerFailures,
        @Nullable GapState finalGapState,
        List<String> notes
) {
    public RunMetadata {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
