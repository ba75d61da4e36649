package com.example.forecast.stage;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient stage failures.
 *
 * @param maxRetries     retries after the first attempt
 * @param initialBackoff delay before the first retry
 * @param multiplier     growth factor between retries
 * @param maxBackoff     upper bound of a single delay
 */
public record RetryPolicy(
        int maxRetries,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff
) {
    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries < 0");
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("invalid initialBackoff");
        }
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier < 1.0");
        if (maxBackoff == null) maxBackoff = Duration.ofSeconds(2);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(2, Duration.ofMillis(100), 2.0, Duration.ofSeconds(2));
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ofMillis(100), 1.0, Duration.ofMillis(100));
    }

    /**
     * Delay before the retry that follows attempt {@code attempt} (1-based),
     * or {@code null} when no retry is left.
     */
    public Duration nextDelay(int attempt) {
        if (attempt > maxRetries) return null;
        double factor = Math.pow(multiplier, attempt - 1);
        long delayMillis = Math.min((long) (initialBackoff.toMillis() * factor), maxBackoff.toMillis());
        return Duration.ofMillis(delayMillis);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
