package com.autoresearch.research.scoring;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.SourceRecord;
import com.autoresearch.support.TestData;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CredibilityScorerTest {

    private static final String STUDY = "According to a peer-reviewed study published in Nature (2021), researchers "
            + "found that the vaccine reduced symptomatic infection. The analysis covered a large sample size.";

    private final CredibilityScorer scorer = new CredibilityScorer(new ResearchProperties());

    @Test
    void testDomainAuthority() {
        assertEquals(90.0, scorer.domainAuthority("https://www.nature.com/articles/abc"));
        assertEquals(90.0, scorer.domainAuthority("https://med.stanford.edu/news"));
        assertEquals(70.0, scorer.domainAuthority("https://example.org/page"));
        assertEquals(50.0, scorer.domainAuthority("https://blog.example.com/post"));
        assertEquals(30.0, scorer.domainAuthority("http://blog.example.com/post"));
    }

    @Test
    void testScoreIsDeterministicAndBounded() {
        SourceRecord record = TestData.source("brave", "https://www.nature.com/articles/abc", "Vaccine study", STUDY,
                0, 0.9);
        double first = scorer.score(record);
        double second = scorer.score(record);
        assertEquals(first, second);
        assertTrue(first >= 0.0 && first <= 100.0);
    }

    @Test
    void testAuthoritativeSourceOutscoresSensationalOne() {
        SourceRecord authoritative = TestData.source("brave", "https://www.nature.com/articles/abc", "Vaccine study",
                STUDY, 0, 0.9);
        SourceRecord sensational = TestData.source("brave", "http://truth-blog.example.com/x",
                "SHOCKING secret they don't want you to know!!!", "Wake up!!! The deep state conspiracy.", 0, 0.9);
        assertTrue(scorer.score(authoritative) > scorer.score(sensational));
        assertEquals(CredibilityLevel.LOW, CredibilityLevel.of(scorer.score(sensational)));
    }

    @Test
    void testMissingMetadataFallsBackToNeutral() {
        SourceRecord bare = TestData.source("duckduckgo", "", "", "", 0, 0.5);
        double score = scorer.score(bare);
        // neutral domain, quality and citations with no bias: 50*0.4 + 50*0.25 + 100*0.2 + 50*0.15
        assertEquals(60.0, score);
    }

    @Test
    void testAuthorAndRecencyAdjustments() {
        SourceRecord base = TestData.source("exa", "https://blog.example.com/post", "Vaccine notes", STUDY, 0, 0.5);
        SourceRecord authored = new SourceRecord(base.originProvider(), base.url(), base.normalizedUrl(),
                base.title(), base.snippet(), base.fetchedAt(), null, "Jane Doe", 0, 0.5);
        assertEquals(5.0, scorer.score(authored) - scorer.score(base), 0.11);

        SourceRecord recent = withPublished(base, base.fetchedAt().minus(Duration.ofDays(200)));
        SourceRecord stale = withPublished(base, base.fetchedAt().minus(Duration.ofDays(12 * 365)));
        assertEquals(10.0, scorer.score(recent) - scorer.score(stale), 0.11);
    }

    @Test
    void testReport() {
        List<SourceRecord> sources = List.of(
                TestData.source("a", "https://a.example.com", "a", "a", 85, 0.5),
                TestData.source("b", "https://b.example.com", "b", "b", 65, 0.5),
                TestData.source("c", "https://c.example.com", "c", "c", 30, 0.5));

        CredibilityReport report = scorer.report(sources);

        assertEquals(3, report.totalSources());
        assertEquals(60.0, report.averageScore());
        assertEquals(65.0, report.medianScore());
        assertEquals(1, report.high());
        assertEquals(1, report.medium());
        assertEquals(1, report.low());
        assertEquals(0, scorer.report(List.of()).totalSources());
    }

    private static SourceRecord withPublished(SourceRecord base, java.time.Instant publishedAt) {
        return new SourceRecord(base.originProvider(), base.url(), base.normalizedUrl(), base.title(), base.snippet(),
                base.fetchedAt(), publishedAt, null, 0, base.relevanceScore());
    }
}
