package com.autoresearch.research.model;

import com.autoresearch.research.search.ProviderException;

public record ProviderFailure(
        String provider,
        ProviderException.Kind kind,
        String message
) {
}
