package com.autoresearch.research.model;

import java.util.List;

public record SubTopic(
        String label,
        List<String> keywords
) {
    public SubTopic {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
