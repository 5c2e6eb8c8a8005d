package com.autoresearch.research.search;

import com.autoresearch.research.model.RawResult;

import java.time.Duration;
import java.util.List;

/**
 * One external search backend. Implementations normalize their response into {@link RawResult} and signal every
 * failure as a {@link ProviderException}.
 */
public interface SearchProvider {

    String name();

    /**
     * Lower values are queried first.
     */
    int priority();

    boolean premiumOnly();

    /**
     * Enabled, with every credential it needs present.
     */
    boolean isAvailable();

    Duration timeout();

    List<RawResult> query(String text, int limit);
}
