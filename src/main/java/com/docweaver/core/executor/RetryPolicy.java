package com.docweaver.core.executor;

import com.docweaver.core.gateway.TransientAgentException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Exponential backoff policy applied uniformly to every unit of work.
 *
 * @param maxAttempts  total attempts including the first; 1 disables retries
 * @param initialDelay delay before the second attempt
 * @param multiplier   growth factor between consecutive delays
 * @param maxDelay     cap on any single delay
 * @param retryable    decides whether a failure may be retried
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    double multiplier,
    Duration maxDelay,
    Predicate<Throwable> retryable
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (retryable == null) {
            retryable = TransientAgentException.class::isInstance;
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(500), 2.0, Duration.ofSeconds(8), null);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, null);
    }

    /**
     * Whether a unit that just failed its {@code attempt}-th attempt (1-based) with
     * {@code error} gets another attempt.
     */
    public boolean shouldRetry(int attempt, Throwable error) {
        return attempt < maxAttempts && retryable.test(error);
    }

    /**
     * Delay to wait after the {@code attempt}-th failed attempt (1-based):
     * {@code initialDelay * multiplier^(attempt-1)}, capped at {@code maxDelay}.
     */
    public Duration delayAfter(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
