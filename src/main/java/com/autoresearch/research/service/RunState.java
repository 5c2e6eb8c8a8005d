package com.autoresearch.research.service;

import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.FailureReason;
import com.autoresearch.research.model.Query;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.ResearchResult;
import com.autoresearch.research.model.Stage;
import com.autoresearch.research.model.UserContext;
import com.autoresearch.research.model.WorkingSetSnapshot;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One research run as seen by the sequencer. Fields read from other threads (stage, last snapshot, cancellation)
 * are published safely; everything else is touched only by the run's own thread.
 */
public class RunState {

    private final String runId;
    private final String queryText;
    private final ResearchMode mode;
    private final UserContext user;
    private final Budget budget;
    private final Instant startedAt;
    private final Instant deadline;
    private final CompletableFuture<Void> cancelSignal = new CompletableFuture<>();
    private final List<String> notes = new ArrayList<>();
    private final AtomicReference<ResearchResult> terminal = new AtomicReference<>();

    private volatile Stage stage;
    private volatile WorkingSetSnapshot lastSnapshot = WorkingSetSnapshot.empty();
    private volatile Query query;
    private volatile FailureReason cancelReason;
    private volatile int iterations;
    private volatile int providerFailures;

    public RunState(String runId, String queryText, ResearchMode mode, UserContext user, Budget budget,
                    Instant startedAt) {
        this.runId = runId;
        this.queryText = queryText;
        this.mode = mode;
        this.user = user;
        this.budget = budget;
        this.startedAt = startedAt;
        this.deadline = startedAt.plus(budget.maxWallTime());
    }

    public String runId() {
        return runId;
    }

    public String queryText() {
        return queryText;
    }

    public ResearchMode mode() {
        return mode;
    }

    public UserContext user() {
        return user;
    }

    public Budget budget() {
        return budget;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant deadline() {
        return deadline;
    }

    public CompletableFuture<Void> cancelSignal() {
        return cancelSignal;
    }

    @Nullable
    public Stage stage() {
        return stage;
    }

    void stage(Stage stage) {
        this.stage = stage;
    }

    public WorkingSetSnapshot lastSnapshot() {
        return lastSnapshot;
    }

    void publish(WorkingSetSnapshot snapshot) {
        this.lastSnapshot = snapshot;
    }

    @Nullable
    public Query query() {
        return query;
    }

    void query(Query query) {
        this.query = query;
    }

    public int iterations() {
        return iterations;
    }

    void iterations(int iterations) {
        this.iterations = iterations;
    }

    public int providerFailures() {
        return providerFailures;
    }

    void addProviderFailures(int count) {
        this.providerFailures += count;
    }

    synchronized void note(String note) {
        notes.add(note);
    }

    public synchronized List<String> notes() {
        return List.copyOf(notes);
    }

    /**
     * First reason wins; later requests are ignored.
     */
    public boolean cancel(FailureReason reason) {
        synchronized (cancelSignal) {
            if (cancelSignal.isDone()) {
                return false;
            }
            cancelReason = reason;
            return cancelSignal.complete(null);
        }
    }

    public boolean isCancelled() {
        return cancelSignal.isDone();
    }

    @Nullable
    public FailureReason cancelReason() {
        return cancelReason;
    }

    /**
     * Records the run's terminal result. Only the first call wins, whether it comes from the run's own thread or
     * from the overrun guard.
     *
     * @return the terminal result, which is {@code result} only for the first caller
     */
    ResearchResult finish(ResearchResult result) {
        return terminal.compareAndSet(null, result) ? result : terminal.get();
    }

    @Nullable
    public ResearchResult terminalResult() {
        return terminal.get();
    }

    /**
     * Called at every suspension point of the run.
     */
    void checkpoint(Clock clock) {
        if (isCancelled()) {
            if (cancelReason == FailureReason.TIMEOUT) {
                throw new RunTimeoutException(runId);
            }
            throw new RunCancelledException(runId);
        }
        if (!clock.instant().isBefore(deadline)) {
            cancel(FailureReason.TIMEOUT);
            throw new RunTimeoutException(runId);
        }
    }
}
