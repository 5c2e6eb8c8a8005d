package com.autoresearch.research.service;

import com.autoresearch.research.model.RunStatus;
import com.autoresearch.research.search.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class ResearchMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong llmFailureCount = new AtomicLong();
    private final AtomicLong fanOutCount = new AtomicLong();
    private final AtomicLong providerCallCount = new AtomicLong();
    private final AtomicLong providerFailureCount = new AtomicLong();
    private final Map<RunStatus, AtomicLong> runsByStatus = new EnumMap<>(RunStatus.class);

    public ResearchMetricsService() {
        for (RunStatus status : RunStatus.values()) {
            runsByStatus.put(status, new AtomicLong());
        }
    }

    public void recordLlmRequest(String purpose) {
        long count = llmRequestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}).", count, purpose);
    }

    public void recordLlmFailure(String purpose, String reason) {
        long count = llmFailureCount.incrementAndGet();
        log.warn("LLM request failed (purpose={}): {}. Total failures={}.", purpose, reason, count);
    }

    public void recordFanOut(int providersQueried, int records, int failures) {
        long count = fanOutCount.incrementAndGet();
        long calls = providerCallCount.addAndGet(providersQueried);
        log.info("Fan-out #{} queried {} provider calls, merged {} records, {} failures. Total provider calls={}.",
                count, providersQueried, records, failures, calls);
    }

    public void recordProviderFailure(String provider, ProviderException.Kind kind) {
        long count = providerFailureCount.incrementAndGet();
        log.debug("Provider {} failed with {}. Total provider failures={}.", provider, kind, count);
    }

    public void recordRunCompleted(RunStatus status) {
        long count = runsByStatus.get(status).incrementAndGet();
        log.info("Run completed with status {}. Total {} runs={}.", status, status, count);
    }

    public long runs(RunStatus status) {
        return runsByStatus.get(status).get();
    }

    public long providerFailures() {
        return providerFailureCount.get();
    }

    @Scheduled(fixedDelayString = "${research.metrics-log-interval:PT15M}",
            initialDelayString = "${research.metrics-log-interval:PT15M}")
    public void logSummary() {
        log.info("Research stats: llmRequests={}, llmFailures={}, fanOuts={}, providerCalls={}, providerFailures={}, "
                        + "runs={}.", llmRequestCount.get(), llmFailureCount.get(), fanOutCount.get(),
                providerCallCount.get(), providerFailureCount.get(), runsByStatus);
    }
}
