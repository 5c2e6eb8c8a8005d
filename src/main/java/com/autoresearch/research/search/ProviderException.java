package com.autoresearch.research.search;

import com.autoresearch.research.ResearchException;

public class ProviderException extends ResearchException {

    public enum Kind {
        TIMEOUT, QUOTA, MALFORMED, TRANSPORT
    }

    private final String provider;
    private final Kind kind;

    public ProviderException(String provider, Kind kind, String message) {
        super(provider + ": " + message);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderException(String provider, Kind kind, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public String getProvider() {
        return provider;
    }

    public Kind getKind() {
        return kind;
    }
}
