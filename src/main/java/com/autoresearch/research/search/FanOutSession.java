package com.autoresearch.research.search;

import com.autoresearch.research.model.Tier;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run-scoped fan-out state: providers demoted for the rest of the run, and the run's cancellation signal.
 */
public class FanOutSession {

    private final String runId;
    private final Tier tier;
    private final int resultsPerQuery;
    private final Set<String> demoted = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> cancelSignal;

    public FanOutSession(String runId, Tier tier, int resultsPerQuery, CompletableFuture<Void> cancelSignal) {
        this.runId = runId;
        this.tier = tier;
        this.resultsPerQuery = resultsPerQuery;
        this.cancelSignal = cancelSignal;
    }

    public String runId() {
        return runId;
    }

    public Tier tier() {
        return tier;
    }

    public int resultsPerQuery() {
        return resultsPerQuery;
    }

    public CompletableFuture<Void> cancelSignal() {
        return cancelSignal;
    }

    public boolean isCancelled() {
        return cancelSignal.isDone();
    }

    public void demote(String provider) {
        demoted.add(provider);
    }

    public boolean isDemoted(String provider) {
        return demoted.contains(provider);
    }

    public Set<String> demoted() {
        return Set.copyOf(demoted);
    }
}
