package com.autoresearch.research.gap;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.CoverageStat;
import com.autoresearch.research.model.GapState;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.SourceRecord;
import com.autoresearch.research.model.SubTopic;
import com.autoresearch.research.scoring.CompositeScorer;
import com.autoresearch.research.text.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives the refine loop. After every search round it merges new sources into the working set, evicts down to the
 * source budget and decides between {@code SUFFICIENT}, {@code NEEDS_MORE} and {@code BUDGET_EXHAUSTED}. The budget
 * is checked on every evaluation.
 */
@Component
@Slf4j
public class GapController {

    private static final int MAX_REFINEMENT_TERMS = 2;

    private final CompositeScorer compositeScorer;
    private final ResearchProperties properties;
    private final Clock clock;

    public GapController(CompositeScorer compositeScorer, ResearchProperties properties, Clock clock) {
        this.compositeScorer = compositeScorer;
        this.properties = properties;
        this.clock = clock;
    }

    public AbsorbOutcome absorb(WorkingSet workingSet, List<SourceRecord> incoming, Query query, Budget budget) {
        int added = 0;
        int merged = 0;
        for (SourceRecord record : incoming) {
            Optional<SourceRecord> existing = workingSet.get(record.normalizedUrl());
            if (existing.isEmpty()) {
                workingSet.put(record);
                added++;
                continue;
            }
            SourceRecord current = existing.get();
            SourceRecord richer = record.isRicherThan(current) ? record : current;
            workingSet.put(richer.withRelevance(Math.max(current.relevanceScore(), record.relevanceScore())));
            merged++;
        }
        int evicted = 0;
        List<TopicMatcher> topics = topics(query);
        while (workingSet.size() > budget.maxSources()) {
            SourceRecord victim = chooseEviction(workingSet.sources(), topics);
            workingSet.remove(victim.normalizedUrl());
            evicted++;
        }
        workingSet.updateCoverage(coverage(workingSet.sources(), topics));
        if (evicted > 0) {
            log.debug("Evicted {} sources to stay within {} sources.", evicted, budget.maxSources());
        }
        return new AbsorbOutcome(added, merged, evicted);
    }

    /**
     * @param completedRounds search rounds already run for this query
     */
    public GapDecision evaluate(WorkingSet workingSet, Query query, Budget budget, int completedRounds,
                                Instant deadline) {
        List<TopicMatcher> topics = topics(query);
        Map<String, CoverageStat> coverage = coverage(workingSet.sources(), topics);
        workingSet.updateCoverage(coverage);

        boolean allCovered = coverage.values().stream()
                .allMatch(stat -> stat.corroboratingSources() >= budget.minCorroboration());
        if (allCovered && !coverage.isEmpty()) {
            return new GapDecision(GapState.SUFFICIENT, null, null, coverage);
        }

        boolean roundsLeft = completedRounds < budget.maxIterations();
        boolean timeLeft = clock.instant().isBefore(deadline);
        boolean sourcesLeft = sourceRoom(workingSet, query, budget) > 0;
        if (roundsLeft && timeLeft && sourcesLeft) {
            TopicMatcher worst = worstCovered(topics, coverage);
            String refined = refine(worst.topic(), query);
            log.debug("Round {} needs more coverage on '{}'; refined query '{}'.", completedRounds,
                    worst.topic().label(), refined);
            return new GapDecision(GapState.NEEDS_MORE, refined, worst.topic().label(), coverage);
        }
        log.debug("Budget exhausted after {} rounds (roundsLeft={}, timeLeft={}, sourcesLeft={}).", completedRounds,
                roundsLeft, timeLeft, sourcesLeft);
        return new GapDecision(GapState.BUDGET_EXHAUSTED, null, null, coverage);
    }

    /**
     * Free slots plus sources that corroborate no sub-topic and could be replaced.
     */
    public int sourceRoom(WorkingSet workingSet, Query query, Budget budget) {
        List<TopicMatcher> topics = topics(query);
        long replaceable = workingSet.sources().stream()
                .filter(record -> topics.stream().noneMatch(topic -> corroborates(record, topic)))
                .count();
        return Math.max(0, budget.maxSources() - workingSet.size()) + (int) replaceable;
    }

    /**
     * Refined search text aimed at the named sub-topic, as used for a follow-up round.
     */
    public String refinedQuery(String subTopicLabel, Query query) {
        SubTopic topic = query.subTopics().stream()
                .filter(candidate -> candidate.label().equals(subTopicLabel))
                .findFirst()
                .orElseGet(() -> new SubTopic(subTopicLabel, Tokenizer.words(subTopicLabel)));
        return refine(topic, query);
    }

    public boolean corroborates(SourceRecord record, SubTopic topic) {
        return corroborates(record, matcher(topic));
    }

    /**
     * Lowest composite score first, skipping any record whose removal would leave a covered sub-topic with no
     * corroborating source. Falls back to the plain lowest score when every record is such a sole source.
     */
    SourceRecord chooseEviction(List<SourceRecord> sources, List<TopicMatcher> topics) {
        List<SourceRecord> ascending = new ArrayList<>(sources);
        ascending.sort(compositeScorer.ranking().reversed());
        for (SourceRecord candidate : ascending) {
            if (!isSoleSource(candidate, sources, topics)) {
                return candidate;
            }
        }
        return ascending.get(0);
    }

    private boolean isSoleSource(SourceRecord candidate, List<SourceRecord> sources, List<TopicMatcher> topics) {
        for (TopicMatcher topic : topics) {
            if (!corroborates(candidate, topic)) {
                continue;
            }
            long corroborating = sources.stream().filter(record -> corroborates(record, topic)).count();
            if (corroborating <= 1) {
                return true;
            }
        }
        return false;
    }

    private Map<String, CoverageStat> coverage(List<SourceRecord> sources, List<TopicMatcher> topics) {
        Map<String, CoverageStat> coverage = new LinkedHashMap<>();
        for (TopicMatcher topic : topics) {
            List<SourceRecord> matching = sources.stream().filter(record -> corroborates(record, topic)).toList();
            double average = matching.stream().mapToDouble(SourceRecord::credibilityScore).average().orElse(0.0);
            coverage.put(topic.topic().label(), new CoverageStat(topic.topic().label(), matching.size(),
                    Math.round(average * 10.0) / 10.0));
        }
        return coverage;
    }

    private boolean corroborates(SourceRecord record, TopicMatcher topic) {
        if (record.credibilityScore() < properties.getScoring().getCredibilityFloor()) {
            return false;
        }
        Set<String> available = Tokenizer.tokenSet(record.text());
        return Tokenizer.coverage(topic.tokens(), available) >= properties.getScoring().getTopicMatchThreshold();
    }

    private TopicMatcher worstCovered(List<TopicMatcher> topics, Map<String, CoverageStat> coverage) {
        return topics.stream()
                .min(Comparator.<TopicMatcher>comparingInt(topic -> coverage.get(topic.topic().label())
                                .corroboratingSources())
                        .thenComparingDouble(topic -> coverage.get(topic.topic().label()).averageScore()))
                .orElseThrow();
    }

    private String refine(SubTopic topic, Query query) {
        Set<String> terms = new LinkedHashSet<>();
        terms.add(topic.label());
        Set<String> labelTokens = Tokenizer.tokenSet(topic.label());
        int extra = 0;
        for (String keyword : query.keywords()) {
            if (extra >= MAX_REFINEMENT_TERMS) {
                break;
            }
            if (!labelTokens.contains(Tokenizer.stem(keyword))) {
                terms.add(keyword);
                extra++;
            }
        }
        return String.join(" ", terms);
    }

    /**
     * Sub-topics as matchers; a query without sub-topics is treated as one topic made of its keywords.
     */
    private List<TopicMatcher> topics(Query query) {
        List<SubTopic> subTopics = query.subTopics();
        if (subTopics.isEmpty()) {
            List<String> keywords = query.keywords().isEmpty() ? Tokenizer.words(query.rawText()) : query.keywords();
            subTopics = List.of(new SubTopic(query.rawText(), keywords));
        }
        return subTopics.stream().map(GapController::matcher).toList();
    }

    private static TopicMatcher matcher(SubTopic topic) {
        Set<String> tokens = Tokenizer.tokenSet(String.join(" ", topic.keywords()));
        return new TopicMatcher(topic, tokens.isEmpty() ? Tokenizer.tokenSet(topic.label()) : tokens);
    }

    record TopicMatcher(SubTopic topic, Set<String> tokens) {
    }
}
