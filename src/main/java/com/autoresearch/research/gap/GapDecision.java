package com.autoresearch.research.gap;

import com.autoresearch.research.model.CoverageStat;
import com.autoresearch.research.model.GapState;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Outcome of one coverage evaluation. A refined query and its target sub-topic are present only for
 * {@link GapState#NEEDS_MORE}.
 */
public record GapDecision(
        GapState state,
        @Nullable String refinedQuery,
        @Nullable String targetSubTopic,
        Map<String, CoverageStat> coverage
) {
}
