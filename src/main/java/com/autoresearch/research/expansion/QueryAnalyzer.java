package com.autoresearch.research.expansion;

import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.QueryIntent;
import com.autoresearch.research.text.Tokenizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic first pass over a raw query: typo correction, intent, keywords and search variants. Sub-topics are
 * left to {@link QueryExpansionService}.
 */
@Component
public class QueryAnalyzer {

    static final int MAX_KEYWORDS = 10;
    static final int MAX_VARIANTS = 5;

    private static final Map<QueryIntent, Pattern> INTENT_PATTERNS = new LinkedHashMap<>();
    private static final Map<String, String> CORRECTIONS = new LinkedHashMap<>();
    private static final Map<String, List<String>> SYNONYMS = new LinkedHashMap<>();

    static {
        INTENT_PATTERNS.put(QueryIntent.DEFINITION, Pattern.compile("^(what is|what are|define|meaning of)\\b"));
        INTENT_PATTERNS.put(QueryIntent.HOW_TO, Pattern.compile("^(how to|how do|how can)\\b"));
        INTENT_PATTERNS.put(QueryIntent.WHY, Pattern.compile("^(why|what causes|what leads to)\\b"));
        INTENT_PATTERNS.put(QueryIntent.COMPARISON, Pattern.compile("\\b(compare|difference between|versus|vs)\\b"));
        INTENT_PATTERNS.put(QueryIntent.PROS_CONS,
                Pattern.compile("\\b(advantages|disadvantages|pros|cons|benefits|drawbacks)\\b"));
        INTENT_PATTERNS.put(QueryIntent.EXAMPLES, Pattern.compile("\\b(examples of|case studies|instances of)\\b"));
        INTENT_PATTERNS.put(QueryIntent.STATISTICS, Pattern.compile("\\b(statistics|data|numbers|percentage)\\b"));
        INTENT_PATTERNS.put(QueryIntent.HISTORY, Pattern.compile("\\b(history of|evolution of|origin of)\\b"));
        INTENT_PATTERNS.put(QueryIntent.FUTURE, Pattern.compile("\\b(future of|trends in|predictions)\\b"));
        INTENT_PATTERNS.put(QueryIntent.LOCATION, Pattern.compile("\\b(where|location|place)\\b"));
        INTENT_PATTERNS.put(QueryIntent.TIME, Pattern.compile("\\b(when|timeline|date)\\b"));

        CORRECTIONS.put("artifical", "artificial");
        CORRECTIONS.put("inteligence", "intelligence");
        CORRECTIONS.put("seperate", "separate");
        CORRECTIONS.put("definately", "definitely");
        CORRECTIONS.put("recieve", "receive");
        CORRECTIONS.put("occured", "occurred");
        CORRECTIONS.put("untill", "until");
        CORRECTIONS.put("acheive", "achieve");
        CORRECTIONS.put("enviroment", "environment");
        CORRECTIONS.put("goverment", "government");

        SYNONYMS.put("ai", List.of("artificial intelligence", "machine learning"));
        SYNONYMS.put("health", List.of("healthcare", "medical"));
        SYNONYMS.put("technology", List.of("tech", "innovation"));
        SYNONYMS.put("business", List.of("company", "enterprise"));
        SYNONYMS.put("education", List.of("learning", "teaching"));
        SYNONYMS.put("climate", List.of("environmental", "global warming"));
        SYNONYMS.put("economy", List.of("economic", "financial"));
        SYNONYMS.put("impact", List.of("effects", "influence"));
    }

    public Query analyze(String rawText) {
        String raw = rawText == null ? "" : rawText.trim();
        String corrected = correct(raw);
        String normalized = Tokenizer.normalize(corrected);
        List<String> keywords = keywords(corrected);
        return new Query(raw, normalized, keywords, classify(normalized), variants(corrected, keywords), List.of());
    }

    String correct(String query) {
        String corrected = query;
        for (Map.Entry<String, String> entry : CORRECTIONS.entrySet()) {
            corrected = Pattern.compile("\\b" + entry.getKey() + "\\b", Pattern.CASE_INSENSITIVE)
                    .matcher(corrected)
                    .replaceAll(entry.getValue());
        }
        return corrected;
    }

    QueryIntent classify(String normalized) {
        for (Map.Entry<QueryIntent, Pattern> entry : INTENT_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(normalized).find()) {
                return entry.getKey();
            }
        }
        return QueryIntent.GENERAL;
    }

    List<String> keywords(String query) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String word : Tokenizer.words(query)) {
            if (word.length() > 2 && !Tokenizer.STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
            if (keywords.size() >= MAX_KEYWORDS) {
                break;
            }
        }
        return new ArrayList<>(keywords);
    }

    /**
     * Original query first, then synonym rewrites, then generic search phrasings; at most {@value #MAX_VARIANTS}.
     */
    List<String> variants(String query, List<String> keywords) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(query);
        for (String keyword : keywords) {
            List<String> synonyms = SYNONYMS.get(keyword.toLowerCase(Locale.ROOT));
            if (synonyms == null) {
                continue;
            }
            for (String synonym : synonyms) {
                String rewritten = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE)
                        .matcher(query)
                        .replaceAll(synonym);
                if (!rewritten.equalsIgnoreCase(query)) {
                    variants.add(rewritten);
                }
            }
        }
        String core = keywords.isEmpty() ? query : String.join(" ", keywords);
        variants.add(core + " overview");
        variants.add(core + " research studies");
        return variants.stream().limit(MAX_VARIANTS).toList();
    }
}
