package com.autoresearch.research.gap;

public record AbsorbOutcome(
        int added,
        int merged,
        int evicted
) {
}
