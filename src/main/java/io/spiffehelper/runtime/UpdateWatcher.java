package io.spiffehelper.runtime;

import io.spiffehelper.model.CredentialSnapshot;
import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;
import io.spiffehelper.process.SignalDispatcher;
import io.spiffehelper.source.CredentialSource;
import io.spiffehelper.source.UpdateChannel;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Writes every new snapshot and, after a successful write, signals dependent
 * processes. A failed write or any other failure while handling one update is
 * logged and the next update is awaited; losing the update channel, or a
 * failure outside update handling, is reported through {@code onFatal}.
 */
public final class UpdateWatcher implements Runnable {
    private final CredentialSource source;
    private final UpdateChannel.Receiver updates;
    private final CredentialPublisher publisher;
    private final SignalDispatcher dispatcher;
    private final ShutdownSignal shutdown;
    private final Consumer<DaemonException> onFatal;
    private final EventSink events;

    public UpdateWatcher(
            CredentialSource source,
            UpdateChannel.Receiver updates,
            CredentialPublisher publisher,
            SignalDispatcher dispatcher,
            ShutdownSignal shutdown,
            Consumer<DaemonException> onFatal,
            EventSink events
    ) {
        this.source = source;
        this.updates = updates;
        this.publisher = publisher;
        this.dispatcher = dispatcher;
        this.shutdown = shutdown;
        this.onFatal = onFatal;
        this.events = events;
    }

    @Override
    public void run() {
        try {
            watch();
        } catch (RuntimeException e) {
            onFatal.accept(new DaemonException("Update watcher failed: " + e.getMessage(), e));
        }
    }

    private void watch() {
        while (true) {
            CompletableFuture<Void> changed = updates.changed();
            if (shutdown.awaitEither(changed)) {
                return;
            }
            try {
                changed.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                events.emit(DaemonEvent.error("watcher.channel_closed", "Update channel closed: " + cause.getMessage(),
                        Map.of()));
                onFatal.accept(new DaemonException("update channel closed", cause));
                return;
            }
            updates.markSeen();
            try {
                handleUpdate(source.current());
            } catch (RuntimeException e) {
                events.emit(DaemonEvent.error("watcher.update_failed", "Failed to process update: " + e.getMessage(),
                        Map.of("error", e.getClass().getName())));
            }
        }
    }

    void handleUpdate(CredentialSnapshot snapshot) {
        events.emit(DaemonEvent.info("watcher.update", "Received update",
                Map.of("spiffe_id", snapshot.credential().spiffeId())));
        try {
            publisher.publish(snapshot);
        } catch (IOException | RuntimeException e) {
            events.emit(DaemonEvent.error("watcher.write_failed", "Failed to write updated credentials: " + e.getMessage(),
                    Map.of("spiffe_id", snapshot.credential().spiffeId())));
            return;
        }
        dispatcher.dispatch();
    }
}
