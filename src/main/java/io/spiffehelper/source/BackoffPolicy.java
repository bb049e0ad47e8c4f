package io.spiffehelper.source;

import java.time.Duration;

/**
 * Exponential backoff: {@code initialDelay} doubling per attempt up to
 * {@code maxDelay}, for at most {@code maxAttempts} attempts in total.
 */
public record BackoffPolicy(Duration initialDelay, Duration maxDelay, int maxAttempts) {
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(16);
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    public BackoffPolicy {
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initial delay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("max delay must be at least the initial delay");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max attempts must be at least 1");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Delay to wait after failed attempt number {@code attempt} (1-based).
     */
    public Duration delayAfterAttempt(int attempt) {
        long maxMs = maxDelay.toMillis();
        long delay = initialDelay.toMillis();
        for (int i = 1; i < attempt; i++) {
            if (delay >= maxMs / 2L) {
                delay = maxMs;
                break;
            }
            delay *= 2L;
        }
        return Duration.ofMillis(Math.min(delay, maxMs));
    }
}
