package com.autoresearch.research.verify;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.gap.GapController;
import com.autoresearch.research.llm.GenerationConstraints;
import com.autoresearch.research.llm.GenerationException;
import com.autoresearch.research.llm.TextGenerationService;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.Claim;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.SourceRecord;
import com.autoresearch.research.model.SubTopic;
import com.autoresearch.research.model.WorkingSetSnapshot;
import com.autoresearch.research.scoring.CompositeScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.autoresearch.research.llm.ResearchPrompts.*;

/**
 * VERIFYING stage. Builds one claim per sub-topic from the sources that corroborate it. Confidence measures
 * corroboration (count against the required minimum, weighted by average credibility), not truth.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FactVerificationService {

    private static final int MAX_EXCERPTS = 3;
    private static final int MAX_EXCERPT_CHARS = 400;

    private final GapController gapController;
    private final CompositeScorer compositeScorer;
    private final TextGenerationService textGenerationService;
    private final ResearchProperties properties;

    public VerificationOutcome verify(Query query, WorkingSetSnapshot workingSet, Budget budget) {
        List<SubTopic> topics = query.subTopics().isEmpty()
                ? List.of(new SubTopic(query.rawText(), query.keywords()))
                : query.subTopics();
        List<Claim> claims = new ArrayList<>();
        for (SubTopic topic : topics) {
            claims.add(claimFor(topic, query, workingSet.sources(), budget));
        }

        Claim weakest = claims.stream().min(Comparator.comparingDouble(Claim::confidence)).orElse(null);
        ResearchProperties.VerificationConfig config = properties.getVerification();
        boolean needsExtraRound = config.isExtraCycleEnabled() && weakest != null
                && weakest.confidence() < config.getMinClaimConfidence();
        return new VerificationOutcome(claims, weakest == null ? null : weakest.subTopic(), needsExtraRound);
    }

    Claim claimFor(SubTopic topic, Query query, List<SourceRecord> sources, Budget budget) {
        List<SourceRecord> supporting = sources.stream()
                .filter(record -> gapController.corroborates(record, topic))
                .sorted(compositeScorer.ranking())
                .toList();
        if (supporting.isEmpty()) {
            return new Claim(topic.label(), "No corroborating sources were found for " + topic.label() + ".",
                    List.of(), 0.0);
        }
        double averageCredibility = supporting.stream().mapToDouble(SourceRecord::credibilityScore).average()
                .orElse(0.0);
        double corroboration = Math.min(1.0, (double) supporting.size() / budget.minCorroboration());
        double confidence = Math.round(averageCredibility * corroboration * 10.0) / 10.0;
        List<String> urls = supporting.stream().map(SourceRecord::url).toList();
        return new Claim(topic.label(), statement(topic, query, supporting), urls, confidence);
    }

    private String statement(SubTopic topic, Query query, List<SourceRecord> supporting) {
        String prompt = claimPrompt(topic, query, supporting);
        try {
            return textGenerationService.generate(prompt, GenerationConstraints.of(PURPOSE_CLAIM, CLAIM_SYSTEM_PROMPT)
                    .withMaxWords(60));
        } catch (GenerationException ex) {
            log.warn("Claim wording failed for '{}': {}", topic.label(), ex.getMessage());
        }
        try {
            return textGenerationService.generate(prompt,
                    GenerationConstraints.of(PURPOSE_CLAIM_RETRY, CLAIM_RETRY_SYSTEM_PROMPT).withMaxWords(40));
        } catch (GenerationException ex) {
            log.warn("Claim wording retry failed for '{}', using template: {}", topic.label(), ex.getMessage());
        }
        return templated(topic, supporting);
    }

    private String claimPrompt(SubTopic topic, Query query, List<SourceRecord> supporting) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Question: ").append(query.rawText()).append('\n');
        prompt.append("Sub-topic: ").append(topic.label()).append("\n\nExcerpts:\n");
        int index = 1;
        for (SourceRecord record : supporting.subList(0, Math.min(MAX_EXCERPTS, supporting.size()))) {
            String snippet = record.snippet().length() > MAX_EXCERPT_CHARS
                    ? record.snippet().substring(0, MAX_EXCERPT_CHARS)
                    : record.snippet();
            prompt.append(index++).append(". ").append(record.title()).append(": ").append(snippet).append('\n');
        }
        return prompt.toString();
    }

    private String templated(SubTopic topic, List<SourceRecord> supporting) {
        String lead = supporting.get(0).title();
        if (supporting.size() == 1) {
            return "One source discusses " + topic.label() + ": \"" + lead + "\".";
        }
        return supporting.size() + " sources discuss " + topic.label() + ", including \"" + lead + "\".";
    }
}
