package com.autoresearch.research.model;

import org.springframework.lang.Nullable;

import java.util.List;

public record ResearchResult(
        String runId,
        RunStatus status,
        @Nullable FailureReason failureReason,
        @Nullable Query query,
        WorkingSetSnapshot workingSet,
        List<Claim> claims,
        @Nullable Report report,
        RunMetadata metadata
) {
    public ResearchResult {
        claims = claims == null ? List.of() : List.copyOf(claims);
        workingSet = workingSet == null ? WorkingSetSnapshot.empty() : workingSet;
    }
}
