package com.autoresearch.research.scoring;

public enum CredibilityLevel {
    HIGH, MEDIUM, LOW;

    public static CredibilityLevel of(double score) {
        if (score >= 80.0) {
            return HIGH;
        }
        if (score >= 60.0) {
            return MEDIUM;
        }
        return LOW;
    }
}
