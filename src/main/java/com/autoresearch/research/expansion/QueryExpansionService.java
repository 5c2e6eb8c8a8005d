package com.autoresearch.research.expansion;

import com.autoresearch.research.llm.GenerationConstraints;
import com.autoresearch.research.llm.GenerationException;
import com.autoresearch.research.llm.JsonProcessingService;
import com.autoresearch.research.llm.TextGenerationService;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.SubTopic;
import com.autoresearch.research.text.Tokenizer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.autoresearch.research.llm.ResearchPrompts.*;

/**
 * EXPANDING stage. Sub-topics come from the model; a failed or unparseable answer is retried once with a simpler
 * prompt, after which sub-topics are derived from the keywords so that expansion never fails a run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryExpansionService {

    static final int MAX_SUB_TOPICS = 5;
    private static final int FALLBACK_TOPICS = 3;

    private final QueryAnalyzer analyzer;
    private final TextGenerationService textGenerationService;
    private final JsonProcessingService jsonProcessingService;

    public Query expand(String rawText) {
        Query analyzed = analyzer.analyze(rawText);
        List<SubTopic> subTopics = requestSubTopics(analyzed);
        if (subTopics.isEmpty()) {
            subTopics = fallbackSubTopics(analyzed);
            log.info("Using {} keyword-derived sub-topics for '{}'.", subTopics.size(), analyzed.rawText());
        }
        return analyzed.withSubTopics(subTopics);
    }

    /**
     * Analysis without any model call, for runs served from the cache.
     */
    public Query analyzeOnly(String rawText) {
        Query analyzed = analyzer.analyze(rawText);
        return analyzed.withSubTopics(fallbackSubTopics(analyzed));
    }

    private List<SubTopic> requestSubTopics(Query query) {
        String prompt = "Research question: " + query.rawText();
        try {
            String response = textGenerationService.generate(prompt,
                    GenerationConstraints.of(PURPOSE_SUB_TOPICS, SUB_TOPICS_SYSTEM_PROMPT));
            List<SubTopicDraft> drafts = jsonProcessingService.parseJsonList(PURPOSE_SUB_TOPICS, response,
                    new TypeReference<List<SubTopicDraft>>() {
                    });
            List<SubTopic> parsed = toSubTopics(drafts);
            if (!parsed.isEmpty()) {
                return parsed;
            }
        } catch (GenerationException ex) {
            log.warn("Sub-topic generation failed for '{}': {}", query.rawText(), ex.getMessage());
        }
        try {
            String response = textGenerationService.generate(prompt,
                    GenerationConstraints.of(PURPOSE_SUB_TOPICS_RETRY, SUB_TOPICS_RETRY_SYSTEM_PROMPT));
            List<String> labels = jsonProcessingService.parseJsonList(PURPOSE_SUB_TOPICS_RETRY, response,
                    new TypeReference<List<String>>() {
                    });
            if (labels != null) {
                return toSubTopics(labels.stream().map(label -> new SubTopicDraft(label, List.of())).toList());
            }
        } catch (GenerationException ex) {
            log.warn("Sub-topic retry failed for '{}': {}", query.rawText(), ex.getMessage());
        }
        return List.of();
    }

    private List<SubTopic> toSubTopics(@Nullable List<SubTopicDraft> drafts) {
        if (drafts == null) {
            return List.of();
        }
        Map<String, SubTopic> byLabel = new LinkedHashMap<>();
        for (SubTopicDraft draft : drafts) {
            if (draft == null || !StringUtils.hasText(draft.label())) {
                continue;
            }
            String label = draft.label().trim();
            List<String> keywords = draft.keywords() == null ? List.of() : draft.keywords().stream()
                    .filter(StringUtils::hasText)
                    .map(String::trim)
                    .toList();
            if (keywords.isEmpty()) {
                keywords = Tokenizer.contentTokens(label);
            }
            if (keywords.isEmpty()) {
                continue;
            }
            byLabel.putIfAbsent(label.toLowerCase(Locale.ROOT), new SubTopic(label, keywords));
            if (byLabel.size() >= MAX_SUB_TOPICS) {
                break;
            }
        }
        return new ArrayList<>(byLabel.values());
    }

    /**
     * One sub-topic per leading keyword pair, or the whole query when it has no keywords.
     */
    List<SubTopic> fallbackSubTopics(Query query) {
        List<String> keywords = query.keywords();
        if (keywords.isEmpty()) {
            String label = StringUtils.hasText(query.rawText()) ? query.rawText() : query.normalizedText();
            return List.of(new SubTopic(label, Tokenizer.words(label)));
        }
        List<SubTopic> topics = new ArrayList<>();
        for (int index = 0; index < keywords.size() && topics.size() < FALLBACK_TOPICS; index += 2) {
            List<String> pair = keywords.subList(index, Math.min(index + 2, keywords.size()));
            topics.add(new SubTopic(String.join(" ", pair), pair));
        }
        return topics;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubTopicDraft(String label, List<String> keywords) {
    }
}
