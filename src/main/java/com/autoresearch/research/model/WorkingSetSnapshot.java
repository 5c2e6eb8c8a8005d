package com.autoresearch.research.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;

/**
 * Read-only copy of a working set handed to consumers outside the gap controller.
 */
public record WorkingSetSnapshot(
        List<SourceRecord> sources,
        Map<String, CoverageStat> coverage
) {
    public WorkingSetSnapshot {
        sources = sources == null ? List.of() : List.copyOf(sources);
        coverage = coverage == null ? Map.of() : Map.copyOf(coverage);
    }

    public static WorkingSetSnapshot empty() {
        return new WorkingSetSnapshot(List.of(), Map.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sources.isEmpty();
    }

    public int size() {
        return sources.size();
    }
}
