package com.phodal.tracebrain.store;

import com.phodal.tracebrain.error.DeadlineExceededException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TraceLocksTest {

    @Test
    void shouldKeepStripeCountFixed() {
        TraceLocks locks = new TraceLocks(4);

        for (int i = 0; i < 1000; i++) {
            int stripe = locks.stripeOf("trace-" + i);
            assertTrue(stripe >= 0 && stripe < 4);
        }
        assertEquals(locks.stripeOf("trace-7"), locks.stripeOf("trace-7"));
    }

    @Test
    void shouldTimeOutWhileSameTraceIsHeld() throws Exception {
        TraceLocks locks = new TraceLocks();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> locks.withLock("t", Deadline.none(), "hold", () -> {
                held.countDown();
                await(release);
                return null;
            }));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            assertThrows(DeadlineExceededException.class, () ->
                locks.withLock("t", Deadline.after(Duration.ofMillis(50)), "write", () -> "never"));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            assertEquals("done", locks.withLock("t", Deadline.after(Duration.ofSeconds(1)), "write", () -> "done"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldNotBlockTraceOnAnotherStripe() throws Exception {
        TraceLocks locks = new TraceLocks();
        String other = "b";
        for (int i = 0; locks.stripeOf(other) == locks.stripeOf("a"); i++) {
            other = "b" + i;
        }
        String free = other;
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> locks.withLock("a", Deadline.none(), "hold", () -> {
                held.countDown();
                await(release);
                return null;
            }));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            assertEquals("ok", locks.withLock(free, Deadline.after(Duration.ofMillis(50)), "write", () -> "ok"));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
