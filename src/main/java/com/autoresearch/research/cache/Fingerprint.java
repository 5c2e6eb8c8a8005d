package com.autoresearch.research.cache;

import com.autoresearch.research.model.ResearchMode;

import java.util.Set;

/**
 * Hashed exact-match key plus the normalized token set kept for near-duplicate comparison.
 */
public record Fingerprint(
        String value,
        Set<String> tokens,
        ResearchMode mode
) {
    public Fingerprint {
        tokens = Set.copyOf(tokens);
    }
}
