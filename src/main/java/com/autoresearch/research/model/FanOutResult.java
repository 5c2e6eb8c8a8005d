package com.autoresearch.research.model;

import java.util.List;

public record FanOutResult(
        List<SourceRecord> records,
        List<ProviderFailure> failures,
        List<String> providersQueried,
        boolean deadlineReached
) {
    public FanOutResult {
        records = List.copyOf(records);
        failures = List.copyOf(failures);
        providersQueried = List.copyOf(providersQueried);
    }

    public static FanOutResult empty() {
        return new FanOutResult(List.of(), List.of(), List.of(), false);
    }
}
