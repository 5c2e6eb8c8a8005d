package com.autoresearch.research.search;

import com.autoresearch.config.ResearchProperties;
import com.autoresearch.research.model.BudgetRemaining;
import com.autoresearch.research.model.FanOutResult;
import com.autoresearch.research.model.ProviderFailure;
import com.autoresearch.research.model.RawResult;
import com.autoresearch.research.model.SourceRecord;
import com.autoresearch.research.scoring.CompositeScorer;
import com.autoresearch.research.scoring.CredibilityScorer;
import com.autoresearch.research.service.ResearchMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues one logical search across the eligible providers. Providers are queried concurrently by priority subset,
 * each under its own timeout and the whole call under a total deadline; a failing provider never fails the call.
 * Results are deduplicated by normalized URL, scored and returned best first.
 */
@Service
@Slf4j
public class SearchFanOutService {

    private static final int MAX_VARIANTS_PER_CALL = 3;

    private final ProviderRegistry registry;
    private final ProviderQuotaTracker quotaTracker;
    private final CredibilityScorer credibilityScorer;
    private final CompositeScorer compositeScorer;
    private final ResearchMetricsService metricsService;
    private final ResearchProperties properties;
    private final ExecutorService searchExecutor;
    private final Clock clock;

    public SearchFanOutService(ProviderRegistry registry,
                               ProviderQuotaTracker quotaTracker,
                               CredibilityScorer credibilityScorer,
                               CompositeScorer compositeScorer,
                               ResearchMetricsService metricsService,
                               ResearchProperties properties,
                               @Qualifier("searchExecutor") ExecutorService searchExecutor,
                               Clock clock) {
        this.registry = registry;
        this.quotaTracker = quotaTracker;
        this.credibilityScorer = credibilityScorer;
        this.compositeScorer = compositeScorer;
        this.metricsService = metricsService;
        this.properties = properties;
        this.searchExecutor = searchExecutor;
        this.clock = clock;
    }

    public FanOutResult search(List<String> queryVariants, BudgetRemaining remaining, FanOutSession session) {
        List<String> variants = queryVariants.stream()
                .filter(StringUtils::hasText)
                .distinct()
                .limit(MAX_VARIANTS_PER_CALL)
                .toList();
        if (variants.isEmpty()) {
            return FanOutResult.empty();
        }
        Instant deadline = totalDeadline(remaining);
        int target = Math.max(properties.getMinViableResults(), remaining.sourceQuota());

        Map<String, SourceRecord> merged = new LinkedHashMap<>();
        List<ProviderFailure> failures = new ArrayList<>();
        List<String> queried = new ArrayList<>();
        boolean deadlineReached = false;

        for (List<SearchProvider> subset : registry.prioritySubsets(session.tier())) {
            if (merged.size() >= target) {
                break;
            }
            if (session.isCancelled() || !clock.instant().isBefore(deadline)) {
                deadlineReached = true;
                break;
            }
            deadlineReached = dispatchSubset(subset, variants, session, deadline, merged, failures, queried);
            if (deadlineReached) {
                break;
            }
            log.debug("Run {}: priority subset {} brought merged results to {} (target {}).", session.runId(),
                    subset.stream().map(SearchProvider::name).toList(), merged.size(), target);
        }

        List<SourceRecord> ranked = merged.values().stream()
                .map(record -> record.withCredibility(credibilityScorer.score(record)))
                .sorted(compositeScorer.ranking())
                .toList();
        metricsService.recordFanOut(queried.size(), ranked.size(), failures.size());
        return new FanOutResult(ranked, failures, queried, deadlineReached);
    }

    /**
     * Returns true when the total deadline or cancellation cut the subset short.
     */
    private boolean dispatchSubset(List<SearchProvider> subset, List<String> variants, FanOutSession session,
                                   Instant deadline, Map<String, SourceRecord> merged,
                                   List<ProviderFailure> failures, List<String> queried) {
        Semaphore permits = new Semaphore(Math.max(1, properties.getMaxConcurrentSearches()));
        List<ProviderCall> calls = new ArrayList<>();
        boolean cutShort = false;

        dispatch:
        for (SearchProvider provider : subset) {
            if (session.isDemoted(provider.name())) {
                continue;
            }
            for (String variant : variants) {
                // permit before quota, so a call the deadline prevents never spends a quota unit
                if (!acquire(permits, deadline)) {
                    cutShort = true;
                    break dispatch;
                }
                if (!quotaTracker.tryAcquire(provider.name())) {
                    permits.release();
                    session.demote(provider.name());
                    recordFailure(failures, new ProviderFailure(provider.name(), ProviderException.Kind.QUOTA,
                            "local quota exhausted"));
                    continue dispatch;
                }
                queried.add(provider.name());
                calls.add(new ProviderCall(provider, variant, start(provider, variant, session, permits)));
            }
        }

        if (!calls.isEmpty()) {
            CompletableFuture<Void> all = CompletableFuture.allOf(calls.stream()
                    .map(ProviderCall::future).toArray(CompletableFuture[]::new));
            cutShort |= !awaitAll(all, session, deadline);
        }

        // merge in dispatch order so arrival order cannot influence which duplicate wins
        for (ProviderCall call : calls) {
            CompletableFuture<List<RawResult>> future = call.future();
            if (!future.isDone()) {
                future.cancel(true);
                recordFailure(failures, new ProviderFailure(call.provider().name(), ProviderException.Kind.TIMEOUT,
                        "cut off by fan-out deadline"));
                continue;
            }
            try {
                for (RawResult result : future.join()) {
                    mergeInto(merged, toRecord(result));
                }
            } catch (CompletionException ex) {
                ProviderException failure = unwrap(call.provider(), ex);
                if (failure.getKind() == ProviderException.Kind.QUOTA) {
                    session.demote(call.provider().name());
                    quotaTracker.markExhausted(call.provider().name());
                }
                recordFailure(failures, new ProviderFailure(call.provider().name(), failure.getKind(),
                        failure.getMessage()));
                log.warn("Run {}: provider {} failed for '{}' ({}): {}", session.runId(), call.provider().name(),
                        call.variant(), failure.getKind(), failure.getMessage());
            }
        }
        return cutShort;
    }

    private CompletableFuture<List<RawResult>> start(SearchProvider provider, String variant, FanOutSession session,
                                                     Semaphore permits) {
        int limit = session.resultsPerQuery();
        return CompletableFuture.supplyAsync(() -> {
                    try {
                        return provider.query(variant, limit);
                    } finally {
                        permits.release();
                    }
                }, searchExecutor)
                .orTimeout(provider.timeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean acquire(Semaphore permits, Instant deadline) {
        long waitMillis = Duration.between(clock.instant(), deadline).toMillis();
        if (waitMillis <= 0) {
            return false;
        }
        try {
            return permits.tryAcquire(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Waits for every call, the run's cancellation or the deadline, whichever comes first. Returns true only when
     * every call finished.
     */
    private boolean awaitAll(CompletableFuture<Void> all, FanOutSession session, Instant deadline) {
        long waitMillis = Duration.between(clock.instant(), deadline).toMillis();
        if (waitMillis <= 0) {
            return all.isDone();
        }
        try {
            CompletableFuture.anyOf(all, session.cancelSignal()).get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("Run {}: fan-out deadline reached with providers still pending.", session.runId());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException ex) {
            // individual failures are inspected per call
            log.debug("Run {}: fan-out completed with failures.", session.runId());
        }
        return all.isDone();
    }

    private Instant totalDeadline(BudgetRemaining remaining) {
        Instant fanOutDeadline = clock.instant().plus(properties.getFanOutTimeout());
        return remaining.deadline() != null && remaining.deadline().isBefore(fanOutDeadline)
                ? remaining.deadline()
                : fanOutDeadline;
    }

    private SourceRecord toRecord(RawResult result) {
        return new SourceRecord(result.provider(), result.url(), UrlNormalizer.normalize(result.url()),
                result.title(), result.snippet(), clock.instant(), result.publishedAt(), result.author(), 0.0,
                result.relevance());
    }

    /**
     * Keeps the richer snippet and the higher of the two relevance scores.
     */
    static void mergeInto(Map<String, SourceRecord> merged, SourceRecord incoming) {
        if (!StringUtils.hasText(incoming.normalizedUrl())) {
            return;
        }
        merged.merge(incoming.normalizedUrl(), incoming, (existing, candidate) -> {
            SourceRecord richer = candidate.isRicherThan(existing) ? candidate : existing;
            return richer.withRelevance(Math.max(existing.relevanceScore(), candidate.relevanceScore()));
        });
    }

    private void recordFailure(List<ProviderFailure> failures, ProviderFailure failure) {
        failures.add(failure);
        metricsService.recordProviderFailure(failure.provider(), failure.kind());
    }

    private ProviderException unwrap(SearchProvider provider, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        if (cause instanceof TimeoutException) {
            return new ProviderException(provider.name(), ProviderException.Kind.TIMEOUT,
                    "no answer within " + provider.timeout().toMillis() + " ms", cause);
        }
        return new ProviderException(provider.name(), ProviderException.Kind.TRANSPORT,
                String.valueOf(cause.getMessage()), cause);
    }

    private record ProviderCall(SearchProvider provider, String variant, CompletableFuture<List<RawResult>> future) {
    }
}
