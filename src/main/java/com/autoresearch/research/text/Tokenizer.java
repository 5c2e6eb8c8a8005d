package com.autoresearch.research.text;

import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared text normalization used by the cache fingerprint, query analysis and topic matching, so that all three
 * agree on what a token is.
 */
public final class Tokenizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "but", "by", "can", "do", "does", "for", "from", "has",
            "have", "how", "i", "in", "is", "it", "its", "me", "my", "of", "on", "or", "should", "tell", "that",
            "the", "their", "there", "these", "this", "those", "to", "vs", "was", "were", "what", "when", "where",
            "which", "who", "whom", "why", "will", "with", "would", "about", "explain", "describe", "versus");

    private Tokenizer() {
    }

    /**
     * Lowercases, strips punctuation and collapses whitespace.
     */
    public static String normalize(String text) {
        if (!StringUtils.hasText(text)) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        String stripped = NON_WORD.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static List<String> words(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(normalized));
    }

    /**
     * Non-stop-word tokens in first-seen order, each reduced by {@link #stem(String)}.
     */
    public static List<String> contentTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String word : words(text)) {
            if (STOP_WORDS.contains(word) || word.length() < 2) {
                continue;
            }
            tokens.add(stem(word));
        }
        return new ArrayList<>(tokens);
    }

    public static Set<String> tokenSet(String text) {
        return new LinkedHashSet<>(contentTokens(text));
    }

    /**
     * Plural folding only. Heavier stemming merged unrelated words in practice.
     */
    public static String stem(String word) {
        if (word.length() > 4 && word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss") && !word.endsWith("us")
                && !word.endsWith("is")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    /**
     * Jaccard similarity of two token sets. An empty set is similar to nothing, itself included.
     */
    public static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : left) {
            if (right.contains(token)) {
                intersection++;
            }
        }
        int union = left.size() + right.size() - intersection;
        return (double) intersection / union;
    }

    /**
     * Fraction of {@code required} tokens present in {@code available}.
     */
    public static double coverage(Set<String> required, Set<String> available) {
        if (required.isEmpty()) {
            return 0.0;
        }
        long present = required.stream().filter(available::contains).count();
        return (double) present / required.size();
    }
}
