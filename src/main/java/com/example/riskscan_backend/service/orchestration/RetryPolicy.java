package com.example.riskscan_backend.service.orchestration;

import java.time.Duration;

/**
 * Bounded exponential backoff: {@code min(base * 2^(attempts-1), max)}.
 */
public class RetryPolicy {
    private static final int MAX_SHIFT = 20;

    private final int maxAttempts;
    private final Duration base;
    private final Duration max;

    public RetryPolicy(int maxAttempts, Duration base, Duration max) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.base = base;
        this.max = max;
    }

    /** @param attempts attempts already made. */
    public boolean canRetry(int attempts) {
        return attempts < maxAttempts;
    }

    public Duration backoff(int attempts) {
        int shift = Math.min(Math.max(attempts - 1, 0), MAX_SHIFT);
        Duration d = base.multipliedBy(1L << shift);
        return d.compareTo(max) > 0 ? max : d;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
