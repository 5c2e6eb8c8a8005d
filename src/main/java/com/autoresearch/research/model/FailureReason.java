package com.autoresearch.research.model;

import java.util.Locale;

public enum FailureReason {
    NO_SOURCES, TIMEOUT, CANCELLED, INTERNAL;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
