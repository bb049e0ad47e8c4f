package io.spiffehelper.source;

import java.util.concurrent.CompletableFuture;

/**
 * Version-counted broadcast of "something changed" notifications. Each receiver
 * remembers the last version it has consumed, so an update published while
 * nobody was waiting is still observed by the next {@link Receiver#changed()}
 * call. Several updates published before a receiver consumes collapse into one
 * notification.
 */
public final class UpdateChannel {
    private long version;
    private Throwable closedCause;
    private CompletableFuture<Void> nextChange = new CompletableFuture<>();

    public synchronized void publish() {
        if (closedCause != null) {
            return;
        }
        version++;
        CompletableFuture<Void> fired = nextChange;
        nextChange = new CompletableFuture<>();
        fired.complete(null);
    }

    /**
     * Closes the channel permanently. Every pending and future wait fails with
     * {@link UpdateChannelClosedException}.
     */
    public synchronized void close(Throwable cause) {
        if (closedCause != null) {
            return;
        }
        closedCause = new UpdateChannelClosedException("update channel closed", cause);
        nextChange.completeExceptionally(closedCause);
    }

    public synchronized boolean isClosed() {
        return closedCause != null;
    }

    /**
     * A receiver that has already consumed every update published so far.
     */
    public synchronized Receiver subscribe() {
        return new Receiver(version);
    }

    private synchronized CompletableFuture<Void> changedSince(long seen) {
        if (closedCause != null) {
            return CompletableFuture.failedFuture(closedCause);
        }
        if (version != seen) {
            return CompletableFuture.completedFuture(null);
        }
        return nextChange.copy();
    }

    private synchronized long currentVersion() {
        return version;
    }

    public final class Receiver {
        private volatile long seen;

        private Receiver(long seen) {
            this.seen = seen;
        }

        /**
         * Completes once an update newer than the last consumed one has been
         * published; fails when the channel closes. Does not consume the update:
         * until {@link #markSeen()} is called, every call completes immediately.
         */
        public CompletableFuture<Void> changed() {
            return changedSince(seen);
        }

        /**
         * Consumes every update published so far. Call it before reading the
         * state the update announced, so a publish racing the read is reported
         * again rather than lost.
         */
        public void markSeen() {
            seen = currentVersion();
        }
    }
}
