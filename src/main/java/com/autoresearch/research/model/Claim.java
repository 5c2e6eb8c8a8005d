package com.autoresearch.research.model;

import java.util.List;

/**
 * A statement about one sub-topic together with the sources that corroborate it. Confidence reflects document
 * corroboration only.
 */
public record Claim(
        String subTopic,
        String statement,
        List<String> supportingUrls,
        double confidence
) {
    public Claim {
        supportingUrls = supportingUrls == null ? List.of() : List.copyOf(supportingUrls);
    }
}
