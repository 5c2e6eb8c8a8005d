package com.autoresearch.research.model;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Provider output normalized to one shape at the fan-out boundary.
 */
public record RawResult(
        String provider,
        String url,
        String title,
        String snippet,
        @Nullable Instant publishedAt,
        @Nullable String author,
        double relevance
) {
    public RawResult {
        title = title == null ? "" : title.trim();
        snippet = snippet == null ? "" : snippet.trim();
        relevance = Math.max(0.0, Math.min(1.0, relevance));
    }
}
