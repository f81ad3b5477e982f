package com.phodal.tracebrain.llm;

import com.phodal.tracebrain.error.ValidationException;

import java.time.Duration;

/**
 * Bounds for model calls: attempts after the first, exponential backoff and a per-attempt timeout.
 */
public record RetryPolicy(
    int maxRetries,
    Duration initialBackoff,
    Duration maxBackoff,
    Duration timeout
) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries must not be negative");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new ValidationException("initialBackoff must be a non-negative duration");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ValidationException("timeout must be positive");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(2, Duration.ofMillis(500), Duration.ofSeconds(5), Duration.ofSeconds(30));
    }
}
