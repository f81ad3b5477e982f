package com.phodal.tracebrain.store;

import com.phodal.tracebrain.error.DeadlineExceededException;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of lock stripes keyed by trace id hash. Mutations of the same trace run one at a time;
 * two traces only contend when they hash to the same stripe. The number of locks does not grow
 * with the number of traces.
 */
final class TraceLocks {

    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    TraceLocks() {
        this(DEFAULT_STRIPES);
    }

    TraceLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive, got " + stripeCount);
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    int stripeOf(String traceId) {
        return Math.floorMod(traceId.hashCode(), stripes.length);
    }

    <T> T withLock(String traceId, Deadline deadline, String operation, Supplier<T> action) {
        ReentrantLock lock = stripes[stripeOf(traceId)];
        boolean acquired;
        try {
            acquired = lock.tryLock(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException(operation + " (interrupted while waiting for trace " + traceId + ")");
        }
        if (!acquired) {
            throw new DeadlineExceededException(operation + " (waiting for trace " + traceId + ")");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
