package com.autoresearch.research.model;

import java.util.List;

public record Report(
        String text,
        List<String> references,
        String citationStyle,
        boolean edited,
        String publicationId
) {
    public Report {
        references = references == null ? List.of() : List.copyOf(references);
    }

    public int wordCount() {
        return text == null || text.isBlank() ? 0 : text.trim().split("\\s+").length;
    }
}
