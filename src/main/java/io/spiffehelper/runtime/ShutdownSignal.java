package io.spiffehelper.runtime;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way cancellation shared by every daemon activity. Cancelling fires
 * exactly once; later calls are no-ops.
 */
public final class ShutdownSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final Set<CompletableFuture<Void>> waiters = ConcurrentHashMap.newKeySet();

    /**
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        latch.countDown();
        completion.complete(null);
        for (CompletableFuture<Void> waiter : waiters) {
            waiter.complete(null);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if cancelled, false if the timeout elapsed first
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    /**
     * A future that completes when the signal fires. Each call returns a fresh
     * dependent copy, so callers cannot complete the signal through it. Meant for
     * one-off waits; loops should use {@link #awaitEither(CompletableFuture)}.
     */
    public CompletableFuture<Void> whenCancelled() {
        return completion.copy();
    }

    /**
     * Blocks until {@code other} completes (normally or not) or this signal fires.
     * The wait leaves nothing registered on the signal once it returns.
     *
     * @return true if the signal has fired
     */
    public boolean awaitEither(CompletableFuture<?> other) {
        CompletableFuture<Void> wake = new CompletableFuture<>();
        waiters.add(wake);
        try {
            if (isCancelled()) {
                return true;
            }
            other.whenComplete((value, error) -> wake.complete(null));
            wake.join();
        } finally {
            waiters.remove(wake);
        }
        return isCancelled();
    }

    int pendingWaiters() {
        return waiters.size();
    }
}
