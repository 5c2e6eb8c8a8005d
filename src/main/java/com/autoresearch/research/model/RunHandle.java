package com.autoresearch.research.model;

import java.time.Instant;

public record RunHandle(
        String runId,
        Instant createdAt
) {
}
