package com.autoresearch.research.gap;

import com.autoresearch.research.model.CoverageStat;
import com.autoresearch.research.model.SourceRecord;
import com.autoresearch.research.model.WorkingSetSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A run's accepted sources, unique by normalized URL, plus the coverage map. Only {@link GapController} mutates it;
 * everyone else reads {@link #snapshot()}.
 */
public class WorkingSet {

    private final Map<String, SourceRecord> sources = new LinkedHashMap<>();
    private Map<String, CoverageStat> coverage = Map.of();

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    public List<SourceRecord> sources() {
        return List.copyOf(sources.values());
    }

    public Map<String, CoverageStat> coverage() {
        return coverage;
    }

    public WorkingSetSnapshot snapshot() {
        return new WorkingSetSnapshot(new ArrayList<>(sources.values()), coverage);
    }

    Optional<SourceRecord> get(String normalizedUrl) {
        return Optional.ofNullable(sources.get(normalizedUrl));
    }

    void put(SourceRecord record) {
        sources.put(record.normalizedUrl(), record);
    }

    void remove(String normalizedUrl) {
        sources.remove(normalizedUrl);
    }

    void updateCoverage(Map<String, CoverageStat> updated) {
        coverage = Map.copyOf(updated);
    }

    /**
     * Restores a working set from a cached snapshot.
     */
    public static WorkingSet of(WorkingSetSnapshot snapshot) {
        WorkingSet workingSet = new WorkingSet();
        snapshot.sources().forEach(workingSet::put);
        workingSet.updateCoverage(snapshot.coverage());
        return workingSet;
    }
}
