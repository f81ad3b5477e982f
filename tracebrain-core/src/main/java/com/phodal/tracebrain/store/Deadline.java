package com.phodal.tracebrain.store;

import com.phodal.tracebrain.error.DeadlineExceededException;

import java.time.Duration;
import java.time.Instant;

/**
 * Caller-supplied point in time after which an operation must give up.
 *
 * @param expiresAt expiry instant, {@code null} for no deadline
 */
public record Deadline(Instant expiresAt) {

    private static final Deadline NONE = new Deadline(null);

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration timeout) {
        return new Deadline(Instant.now().plus(timeout));
    }

    public boolean isExpired() {
        return expiresAt != null && !Instant.now().isBefore(expiresAt);
    }

    /**
     * Time left, or {@link Duration#ZERO} once expired. Unbounded deadlines report a very long duration.
     */
    public Duration remaining() {
        if (expiresAt == null) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        Duration left = Duration.between(Instant.now(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void check(String operation) {
        if (isExpired()) {
            throw new DeadlineExceededException(operation);
        }
    }
}
