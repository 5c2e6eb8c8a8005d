package com.autoresearch.research.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public record BudgetRemaining(
        int sourceQuota,
        Instant deadline
) {
    public Duration timeLeft(Clock clock) {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean exhausted(Clock clock) {
        return sourceQuota <= 0 || !clock.instant().isBefore(deadline);
    }
}
