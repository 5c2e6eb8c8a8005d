package com.autoresearch.research.scoring;

public record CredibilityReport(
        int totalSources,
        double averageScore,
        double medianScore,
        int high,
        int medium,
        int low
) {
    public static CredibilityReport empty() {
        return new CredibilityReport(0, 0.0, 0.0, 0, 0, 0);
    }
}
