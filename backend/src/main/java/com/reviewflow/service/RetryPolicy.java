package com.reviewflow.service;

import com.reviewflow.config.ReviewflowProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: the n-th retry (0-based) waits {@code initialDelay * multiplier^n}.
 */
public record RetryPolicy(
        int maxRetries,
        Duration initialDelay,
        double multiplier
) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        Objects.requireNonNull(initialDelay, "initialDelay is required");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
    }

    public static RetryPolicy from(ReviewflowProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxRetries(), retry.getInitialDelay(), retry.getMultiplier());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, 1.0d);
    }

    public Duration delayBeforeRetry(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("retryIndex must not be negative");
        }
        double factor = Math.pow(multiplier, retryIndex);
        return Duration.ofMillis(Math.round(initialDelay.toMillis() * factor));
    }
}
