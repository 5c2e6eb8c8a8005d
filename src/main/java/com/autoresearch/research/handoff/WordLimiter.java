package com.autoresearch.research.handoff;

/**
 * Trims text to a word budget, preferring to cut at the last sentence end inside the budget.
 */
public final class WordLimiter {

    private WordLimiter() {
    }

    public static int count(String text) {
        return text == null || text.isBlank() ? 0 : text.trim().split("\\s+").length;
    }

    public static String limit(String text, int maxWords) {
        if (text == null || maxWords <= 0 || count(text) <= maxWords) {
            return text;
        }
        String[] words = text.trim().split("\\s+");
        StringBuilder kept = new StringBuilder();
        int lastSentenceEnd = -1;
        for (int index = 0; index < maxWords; index++) {
            if (index > 0) {
                kept.append(' ');
            }
            kept.append(words[index]);
            if (words[index].endsWith(".") || words[index].endsWith("!") || words[index].endsWith("?")) {
                lastSentenceEnd = kept.length();
            }
        }
        if (lastSentenceEnd > kept.length() / 2) {
            return kept.substring(0, lastSentenceEnd);
        }
        return kept.toString();
    }
}
