package com.plainer.collab.client.transport;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter: attempt {@code n} waits {@code initialDelay * 2^(n-1)}, spread by
 * {@code ±jitter} and capped at {@code maxDelay}.
 */
public record BackoffPolicy(Duration initialDelay, Duration maxDelay, int maxAttempts, double jitter) {

    public BackoffPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
    }

    /**
     * @param attempt 1-based reconnection attempt
     * @param random uniform sample in [0, 1)
     */
    public Duration delayFor(int attempt, DoubleSupplier random) {
        long initial = initialDelay.toMillis();
        long cap = maxDelay.toMillis();
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long base = Math.min(cap, initial * (1L << exponent));
        double spread = 1 - jitter + 2 * jitter * random.getAsDouble();
        long delay = Math.round(base * spread);
        return Duration.ofMillis(Math.max(0, Math.min(cap, delay)));
    }

    public boolean isExhausted(int attempt) {
        return attempt > maxAttempts;
    }
}
