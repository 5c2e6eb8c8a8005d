package com.autoresearch.research.search;

import com.autoresearch.config.ResearchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider request counters over a rolling window, shared by every run. A provider without a configured limit
 * is never throttled here.
 */
@Component
@Slf4j
public class ProviderQuotaTracker {

    private final ResearchProperties properties;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public ProviderQuotaTracker(ResearchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Reserves one request. Returns false when the provider's quota for the current window is used up.
     */
    public boolean tryAcquire(String provider) {
        ResearchProperties.ProviderSettings settings = properties.getProviderSettings(provider);
        int limit = settings.getQuotaLimit();
        if (limit <= 0) {
            return true;
        }
        Window window = windows.computeIfAbsent(provider, key -> new Window(clock.instant()));
        synchronized (window) {
            window.rollIfElapsed(clock.instant(), settings.getQuotaWindow());
            if (window.used >= limit) {
                return false;
            }
            window.used++;
            return true;
        }
    }

    /**
     * The provider reported its quota exceeded; treat it as exhausted until the window rolls over.
     */
    public void markExhausted(String provider) {
        ResearchProperties.ProviderSettings settings = properties.getProviderSettings(provider);
        int limit = settings.getQuotaLimit();
        Window window = windows.computeIfAbsent(provider, key -> new Window(clock.instant()));
        synchronized (window) {
            window.rollIfElapsed(clock.instant(), settings.getQuotaWindow());
            window.used = Math.max(window.used, limit);
            window.exhausted = true;
        }
        log.warn("Provider {} marked as quota-exhausted for the current window.", provider);
    }

    public boolean isExhausted(String provider) {
        Window window = windows.get(provider);
        if (window == null) {
            return false;
        }
        ResearchProperties.ProviderSettings settings = properties.getProviderSettings(provider);
        synchronized (window) {
            window.rollIfElapsed(clock.instant(), settings.getQuotaWindow());
            return window.exhausted || (settings.getQuotaLimit() > 0 && window.used >= settings.getQuotaLimit());
        }
    }

    public Map<String, Integer> usage() {
        Map<String, Integer> usage = new LinkedHashMap<>();
        windows.forEach((provider, window) -> {
            synchronized (window) {
                usage.put(provider, window.used);
            }
        });
        return usage;
    }

    private static final class Window {
        private Instant start;
        private int used;
        private boolean exhausted;

        private Window(Instant start) {
            this.start = start;
        }

        private void rollIfElapsed(Instant now, Duration length) {
            if (length != null && !now.isBefore(start.plus(length))) {
                start = now;
                used = 0;
                exhausted = false;
            }
        }
    }
}
