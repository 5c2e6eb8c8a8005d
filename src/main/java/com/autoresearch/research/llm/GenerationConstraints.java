package com.autoresearch.research.llm;

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Per-call limits for text generation. {@code maxWords} of zero means unbounded; a null timeout falls back to the
 * configured generation timeout.
 */
public record GenerationConstraints(
        String purpose,
        @Nullable String systemPrompt,
        int maxWords,
        @Nullable Duration timeout
) {
    public static GenerationConstraints of(String purpose, String systemPrompt) {
        return new GenerationConstraints(purpose, systemPrompt, 0, null);
    }

    public GenerationConstraints withMaxWords(int words) {
        return new GenerationConstraints(purpose, systemPrompt, words, timeout);
    }

    public GenerationConstraints withTimeout(Duration limit) {
        return new GenerationConstraints(purpose, systemPrompt, maxWords, limit);
    }
}
