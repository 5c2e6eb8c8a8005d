package com.autoresearch.research.model;

import java.util.Locale;

public enum ResearchMode {
    QUICK, STANDARD, DEEP;

    public static ResearchMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        return ResearchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
