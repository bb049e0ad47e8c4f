package io.spiffehelper.runtime;

import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Emits a periodic "alive" event until the daemon shuts down.
 */
public final class LivenessHeartbeat implements Runnable {
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    private final ShutdownSignal shutdown;
    private final Duration interval;
    private final EventSink events;

    public LivenessHeartbeat(ShutdownSignal shutdown, Duration interval, EventSink events) {
        this.shutdown = shutdown;
        this.interval = interval;
        this.events = events;
    }

    @Override
    public void run() {
        Instant started = Instant.now();
        while (true) {
            try {
                if (shutdown.await(interval)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            long uptime = Duration.between(started, Instant.now()).toSeconds();
            events.emit(DaemonEvent.info("daemon.alive", "spiffe-helper is alive", Map.of("uptime_s", uptime)));
        }
    }
}
