package com.autoresearch.research.service;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.Budget;
import com.autoresearch.research.model.FailureReason;
import com.autoresearch.research.model.ResearchMode;
import com.autoresearch.research.model.ResearchResult;
import com.autoresearch.research.model.RunHandle;
import com.autoresearch.research.model.Stage;
import com.autoresearch.research.model.Tier;
import com.autoresearch.research.model.UserContext;
import com.autoresearch.stream.ResearchStreamService;
import com.autoresearch.stream.StreamEvent;
import com.autoresearch.stream.ResearchStreamHub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Entry point for research runs. Each run executes on the run executor; callers get a handle back immediately
 * and follow progress through the event stream or poll for the result.
 */
@Slf4j
@Service
public class ResearchEngine {

    private final ResearchSequencer sequencer;
    private final BudgetProvider budgetProvider;
    private final ResearchStreamService streamService;
    private final ResearchStreamHub streamHub;
    private final ResearchProperties properties;
    private final ExecutorService runExecutor;
    private final Clock clock;
    private final Map<String, ActiveRun> runs = new ConcurrentHashMap<>();

    public ResearchEngine(ResearchSequencer sequencer,
                          BudgetProvider budgetProvider,
                          ResearchStreamService streamService,
                          ResearchStreamHub streamHub,
                          ResearchProperties properties,
                          @Qualifier("runExecutor") ExecutorService runExecutor,
                          Clock clock) {
        this.sequencer = sequencer;
        this.budgetProvider = budgetProvider;
        this.streamService = streamService;
        this.streamHub = streamHub;
        this.properties = properties;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    public RunHandle startRun(String queryText, ResearchMode mode, UserContext user) {
        if (!StringUtils.hasText(queryText)) {
            throw new IllegalArgumentException("Query text must not be blank");
        }
        cleanupFinishedRuns();
        ResearchMode effectiveMode = mode == null ? ResearchMode.STANDARD : mode;
        Budget budget = sequencer.effectiveBudget(budgetProvider.resolveBudget(user.userId(), effectiveMode));
        String runId = streamService.createRun();
        Instant startedAt = clock.instant();
        RunState state = new RunState(runId, queryText.trim(), effectiveMode, user, budget, startedAt);

        // the sequencer checks its deadline between stages; the guard covers a stage that overruns it
        Duration guard = budget.maxWallTime().plus(properties.getRunGrace());
        CompletableFuture<ResearchResult> future = CompletableFuture
                .supplyAsync(() -> sequencer.run(state), runExecutor)
                .orTimeout(guard.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    FailureReason reason = unwrap(ex) instanceof TimeoutException
                            ? FailureReason.TIMEOUT : FailureReason.INTERNAL;
                    log.warn("Run {} did not finish cleanly ({}): {}", runId, reason.code(), ex.getMessage());
                    state.cancel(reason);
                    return sequencer.failed(state, reason);
                });
        runs.put(runId, new ActiveRun(state, future));
        log.info("Started run {} for user {} (tier={}, mode={}).", runId, user.userId(), budget.tier(),
                effectiveMode);
        return new RunHandle(runId, startedAt);
    }

    public Stream<StreamEvent> streamEvents(String runId) {
        requireRun(runId);
        return streamHub.stream(runId);
    }

    /**
     * @return the final result, or empty while the run is still in progress
     */
    public Optional<ResearchResult> getResult(String runId) {
        CompletableFuture<ResearchResult> future = requireRun(runId).future();
        if (!future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    /**
     * Blocks until the run finishes or the wait elapses.
     */
    public Optional<ResearchResult> awaitResult(String runId, Duration wait) {
        CompletableFuture<ResearchResult> future = requireRun(runId).future();
        try {
            return Optional.of(future.get(wait.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Run " + runId + " completed exceptionally", ex.getCause());
        }
    }

    /**
     * @return false when the run is unknown or already finished
     */
    public boolean cancel(String runId) {
        ActiveRun run = runs.get(runId);
        if (run == null || run.future().isDone()) {
            return false;
        }
        boolean cancelled = run.state().cancel(FailureReason.CANCELLED);
        if (cancelled) {
            streamService.cancelRun(runId);
            log.info("Cancellation requested for run {}.", runId);
        }
        return cancelled;
    }

    public boolean exists(String runId) {
        return runs.containsKey(runId);
    }

    public Optional<Stage> currentStage(String runId) {
        return Optional.ofNullable(requireRun(runId).state().stage());
    }

    public Tier tierFor(String userId) {
        return budgetProvider.tierFor(userId);
    }

    public List<ResearchMode> availableModes(String userId) {
        return budgetProvider.availableModes(budgetProvider.tierFor(userId));
    }

    private ActiveRun requireRun(String runId) {
        ActiveRun run = runs.get(runId);
        if (run == null) {
            throw new UnknownRunException(runId);
        }
        return run;
    }

    private void cleanupFinishedRuns() {
        Instant cutoff = clock.instant().minus(properties.getRunRetention());
        runs.entrySet().removeIf(entry -> entry.getValue().future().isDone()
                && entry.getValue().state().startedAt().isBefore(cutoff));
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while (current.getCause() != null && current != current.getCause()
                && !(current instanceof TimeoutException)) {
            current = current.getCause();
        }
        return current;
    }

    private record ActiveRun(RunState state, CompletableFuture<ResearchResult> future) {
    }
}
