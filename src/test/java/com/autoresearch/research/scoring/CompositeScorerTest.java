package com.autoresearch.research.scoring;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.SourceRecord;
import com.autoresearch.support.TestData;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CompositeScorerTest {

    private final CompositeScorer scorer = new CompositeScorer(new ResearchProperties());

    @Test
    void testCompositeUsesConfiguredWeights() {
        SourceRecord record = TestData.source("brave", "https://example.com/a", "t", "s", 80, 0.5);
        assertEquals(62.0, scorer.composite(record), 1e-9);
    }

    @Test
    void testRankingBreaksTiesByUrl() {
        SourceRecord strong = TestData.source("brave", "https://example.com/strong", "t", "s", 90, 0.9);
        SourceRecord tiedB = TestData.source("exa", "https://example.com/b", "t", "s", 50, 0.5);
        SourceRecord tiedA = TestData.source("brave", "https://example.com/a", "t", "s", 50, 0.5);

        List<String> ranked = Stream.of(tiedB, tiedA, strong)
                .sorted(scorer.ranking())
                .map(SourceRecord::url)
                .toList();

        assertEquals(List.of("https://example.com/strong", "https://example.com/a", "https://example.com/b"), ranked);
    }

    @Test
    void testRelevanceBreaksCompositeTie() {
        ResearchProperties properties = new ResearchProperties();
        properties.getScoring().setRelevanceWeight(1.0);
        properties.getScoring().setCredibilityWeight(1.0);
        CompositeScorer equalWeights = new CompositeScorer(properties);
        SourceRecord relevant = TestData.source("brave", "https://example.com/z", "t", "s", 25, 0.75);
        SourceRecord credible = TestData.source("brave", "https://example.com/y", "t", "s", 50, 0.5);

        assertEquals(50.0, equalWeights.composite(relevant));
        assertEquals(50.0, equalWeights.composite(credible));
        assertTrue(equalWeights.ranking().compare(relevant, credible) < 0);
    }
}
