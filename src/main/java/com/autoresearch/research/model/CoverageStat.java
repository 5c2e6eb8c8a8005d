package com.autoresearch.research.model;

public record CoverageStat(
        String topic,
        int corroboratingSources,
        double averageScore
) {
}
