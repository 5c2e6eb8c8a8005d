package com.autoresearch.research.model;

import java.util.List;

/**
 * An analysed research query. Produced once by expansion and never mutated afterwards.
 */
public record Query(
        String rawText,
        String normalizedText,
        List<String> keywords,
        QueryIntent intent,
        List<String> variants,
        List<SubTopic> subTopics
) {
    public Query {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        variants = variants == null || variants.isEmpty() ? List.of(rawText) : List.copyOf(variants);
        subTopics = subTopics == null ? List.of() : List.copyOf(subTopics);
        intent = intent == null ? QueryIntent.GENERAL : intent;
    }

    public Query withSubTopics(List<SubTopic> replacement) {
        return new Query(rawText, normalizedText, keywords, intent, variants, replacement);
    }
}
