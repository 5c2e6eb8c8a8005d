package com.autoresearch.research.model;

import org.springframework.lang.Nullable;

import java.time.Instant;

public record SourceRecord(
        String originProvider,
        String url,
        String normalizedUrl,
        String title,
        String snippet,
        Instant fetchedAt,
        @Nullable Instant publishedAt,
        @Nullable String author,
        double credibilityScore,
        double relevanceScore
) {
    public SourceRecord withCredibility(double score) {
        return new SourceRecord(originProvider, url, normalizedUrl, title, snippet, fetchedAt, publishedAt, author,
                score, relevanceScore);
    }

    public SourceRecord withRelevance(double relevance) {
        return new SourceRecord(originProvider, url, normalizedUrl, title, snippet, fetchedAt, publishedAt, author,
                credibilityScore, relevance);
    }

    /**
     * Longer snippet wins; equal lengths fall back to provider name so the choice does not depend on arrival order.
     */
    public boolean isRicherThan(SourceRecord other) {
        int lengthCompare = Integer.compare(snippet.length(), other.snippet.length());
        if (lengthCompare != 0) {
            return lengthCompare > 0;
        }
        return originProvider.compareTo(other.originProvider) < 0;
    }

    public String text() {
        return title + " " + snippet;
    }
}
