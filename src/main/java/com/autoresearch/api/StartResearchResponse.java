package com.autoresearch.api;

import com.autoresearch.research.model.ResearchMode;

import java.time.Instant;

public record StartResearchResponse(
        String runId,
        ResearchMode mode,
        Instant createdAt
) {
}
