package com.autoresearch.research.scoring;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.SourceRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores source credibility in [0,100] from record metadata alone. No network access; identical input always yields
 * the identical score, and recency is measured against the record's own fetch time rather than the wall clock.
 */
@Component
@RequiredArgsConstructor
public class CredibilityScorer {

    private static final List<String> HIGH_AUTHORITY = List.of(
            ".edu", ".ac.uk", ".gov", ".gov.uk", "scholar.google", "arxiv.org", "researchgate.net",
            "pubmed.ncbi.nlm.nih.gov", "ieee.org", "acm.org", "springer.com", "sciencedirect.com", "nature.com",
            "science.org", "who.int", "cdc.gov", "nih.gov", "nasa.gov", "wikipedia.org", "britannica.com",
            "reuters.com", "apnews.com", "bbc.com", "bbc.co.uk", "nytimes.com", "wsj.com", "economist.com",
            "scientificamerican.com");

    private static final List<String> MEDIUM_AUTHORITY = List.of(
            ".org", "medium.com", "forbes.com", "bloomberg.com", "cnbc.com", "theguardian.com",
            "washingtonpost.com", "techcrunch.com", "wired.com", "arstechnica.com", "npr.org", "pbs.org");

    private static final List<String> BIAS_INDICATORS = List.of(
            "fake news", "mainstream media", "deep state", "conspiracy", "they don't want you to know", "wake up",
            "truth revealed", "shocking", "unbelievable", "you won't believe", "this one trick", "doctors hate",
            "secret", "far-left", "far-right", "radical", "extremist");

    private static final List<String> QUALITY_INDICATORS = List.of(
            "according to", "study shows", "research indicates", "published in", "peer-reviewed", "data suggests",
            "dr.", "professor", "ph.d.", "researcher", "expert", "methodology", "sample size", "statistical",
            "analysis");

    private static final List<Pattern> CITATION_PATTERNS = List.of(
            Pattern.compile("\\(\\d{4}\\)"),
            Pattern.compile("\\[\\d+]"),
            Pattern.compile("et al\\."),
            Pattern.compile("according to"),
            Pattern.compile("study"),
            Pattern.compile("research"));

    private static final Pattern EXCESSIVE_PUNCTUATION = Pattern.compile("[!?]{3,}");

    private static final Duration RECENT = Duration.ofDays(2 * 365);
    private static final Duration STALE = Duration.ofDays(10 * 365);

    private final ResearchProperties properties;

    public double score(SourceRecord record) {
        double neutral = properties.getScoring().getNeutralScore();
        String snippet = record.snippet() == null ? "" : record.snippet();
        String title = record.title() == null ? "" : record.title();

        double domain = StringUtils.hasText(record.url()) ? domainAuthority(record.url()) : neutral;
        double quality = StringUtils.hasText(snippet) ? contentQuality(snippet) : neutral;
        double bias = biasLevel(title, snippet);
        double citations = StringUtils.hasText(snippet) ? citationPresence(snippet) : neutral;

        double weighted = domain * 0.4 + quality * 0.25 + (100.0 - bias) * 0.2 + citations * 0.15;
        weighted += authorshipAdjustment(record);
        weighted += recencyAdjustment(record);
        return round(clamp(weighted));
    }

    public CredibilityLevel level(SourceRecord record) {
        return CredibilityLevel.of(record.credibilityScore());
    }

    public CredibilityReport report(List<SourceRecord> sources) {
        if (sources == null || sources.isEmpty()) {
            return CredibilityReport.empty();
        }
        double[] scores = sources.stream().mapToDouble(SourceRecord::credibilityScore).sorted().toArray();
        double sum = 0.0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (double score : scores) {
            sum += score;
            switch (CredibilityLevel.of(score)) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                default -> low++;
            }
        }
        return new CredibilityReport(scores.length, round(sum / scores.length), round(scores[scores.length / 2]),
                high, medium, low);
    }

    double domainAuthority(String url) {
        String host = host(url);
        for (String domain : HIGH_AUTHORITY) {
            if (matchesDomain(host, domain)) {
                return 90.0;
            }
        }
        for (String domain : MEDIUM_AUTHORITY) {
            if (matchesDomain(host, domain)) {
                return 70.0;
            }
        }
        return url.toLowerCase(Locale.ROOT).startsWith("https://") ? 50.0 : 30.0;
    }

    double contentQuality(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        long indicators = QUALITY_INDICATORS.stream().filter(lower::contains).count();
        int wordCount = content.trim().split("\\s+").length;
        double lengthScore = Math.min(wordCount / 50.0 * 100.0, 100.0);

        String[] sentences = content.split("\\.");
        int capitalized = 0;
        for (String sentence : sentences) {
            String trimmed = sentence.trim();
            if (!trimmed.isEmpty() && Character.isUpperCase(trimmed.charAt(0))) {
                capitalized++;
            }
        }
        double grammarScore = (double) capitalized / Math.max(sentences.length, 1) * 100.0;
        return Math.min(indicators * 15 * 0.4 + lengthScore * 0.4 + grammarScore * 0.2, 100.0);
    }

    double biasLevel(String title, String content) {
        String text = title + " " + content;
        String lower = text.toLowerCase(Locale.ROOT);
        long indicators = BIAS_INDICATORS.stream().filter(lower::contains).count();
        int punctuation = count(EXCESSIVE_PUNCTUATION.matcher(lower));

        String[] words = text.trim().split("\\s+");
        int caps = 0;
        for (String word : words) {
            if (word.length() > 3 && word.equals(word.toUpperCase(Locale.ROOT)) && word.chars().anyMatch(Character::isLetter)) {
                caps++;
            }
        }
        double capsRatio = (double) caps / Math.max(words.length, 1);
        return Math.min(indicators * 20 + punctuation * 15 + capsRatio * 100, 100.0);
    }

    double citationPresence(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        int citations = 0;
        for (Pattern pattern : CITATION_PATTERNS) {
            citations += count(pattern.matcher(lower));
        }
        int wordCount = content.trim().split("\\s+").length;
        double density = (double) citations / Math.max(wordCount, 1) * 1000.0;
        return Math.min(density * 20, 100.0);
    }

    private double authorshipAdjustment(SourceRecord record) {
        return StringUtils.hasText(record.author()) ? 5.0 : 0.0;
    }

    private double recencyAdjustment(SourceRecord record) {
        if (record.publishedAt() == null || record.fetchedAt() == null) {
            return 0.0;
        }
        Duration age = Duration.between(record.publishedAt(), record.fetchedAt());
        if (age.isNegative() || age.compareTo(RECENT) <= 0) {
            return 5.0;
        }
        return age.compareTo(STALE) > 0 ? -5.0 : 0.0;
    }

    private static boolean matchesDomain(String host, String domain) {
        if (domain.startsWith(".")) {
            return host.endsWith(domain);
        }
        return host.equals(domain) || host.endsWith("." + domain) || host.contains(domain);
    }

    private static String host(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? url.toLowerCase(Locale.ROOT) : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException ex) {
            return url.toLowerCase(Locale.ROOT);
        }
    }

    private static int count(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
