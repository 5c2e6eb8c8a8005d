package com.autoresearch.research.scoring;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.SourceRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;

/**
 * Combines relevance (0..1) and credibility (0..100) into one 0..100 ranking score using the configured weights.
 */
@Component
@RequiredArgsConstructor
public class CompositeScorer {

    private final ResearchProperties properties;

    public double composite(SourceRecord record) {
        ResearchProperties.ScoringConfig scoring = properties.getScoring();
        double relevanceWeight = Math.max(0.0, scoring.getRelevanceWeight());
        double credibilityWeight = Math.max(0.0, scoring.getCredibilityWeight());
        double total = relevanceWeight + credibilityWeight;
        if (total == 0.0) {
            return record.relevanceScore() * 100.0;
        }
        return (relevanceWeight * record.relevanceScore() * 100.0 + credibilityWeight * record.credibilityScore())
                / total;
    }

    /**
     * Best first: composite, then relevance, then credibility, then normalized URL so ties never depend on arrival
     * order.
     */
    public Comparator<SourceRecord> ranking() {
        return Comparator.comparingDouble(this::composite).reversed()
                .thenComparing(Comparator.comparingDouble(SourceRecord::relevanceScore).reversed())
                .thenComparing(Comparator.comparingDouble(SourceRecord::credibilityScore).reversed())
                .thenComparing(SourceRecord::normalizedUrl);
    }
}
