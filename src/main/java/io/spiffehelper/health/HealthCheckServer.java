package io.spiffehelper.health;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.spiffehelper.config.HealthChecksConfig;
import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Optional HTTP liveness and readiness endpoints. When enabled, a heartbeat
 * thread logs that the listener is alive and probes that it still accepts
 * connections; a failed probe completes {@link #terminated()} exceptionally.
 */
public final class HealthCheckServer {
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    private static final int PROBE_TIMEOUT_MS = 1000;

    private final HttpServer server;
    private final HealthChecksConfig config;
    private final Duration heartbeatInterval;
    private final EventSink events;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private final CountDownLatch stopLatch = new CountDownLatch(1);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Thread heartbeat;
    private final int boundPort;

    private HealthCheckServer(HttpServer server, HealthChecksConfig config, Duration heartbeatInterval, EventSink events) {
        this.server = server;
        this.config = config;
        this.heartbeatInterval = heartbeatInterval;
        this.events = events;
        this.heartbeat = server == null ? null : new Thread(this::runHeartbeat, "spiffe-helper-health-heartbeat");
        this.boundPort = server == null ? -1 : server.getAddress().getPort();
    }

    public static HealthCheckServer start(HealthChecksConfig config, EventSink events) throws IOException {
        return start(config, DEFAULT_HEARTBEAT_INTERVAL, events);
    }

    /**
     * Binds the listener and starts serving. Returns a disabled server when the
     * listener is not enabled.
     *
     * @throws IOException if the port cannot be bound
     */
    public static HealthCheckServer start(HealthChecksConfig config, Duration heartbeatInterval, EventSink events)
            throws IOException {
        if (!config.listenerEnabled()) {
            return new HealthCheckServer(null, config, heartbeatInterval, events);
        }
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(config.bindPort()), 0);
        } catch (IOException e) {
            throw new IOException("Failed to bind health check listener on " + config.bindAddress() + ": "
                    + e.getMessage(), e);
        }
        HealthCheckServer out = new HealthCheckServer(server, config, heartbeatInterval, events);
        server.createContext("/", out::handle);
        server.setExecutor(null);
        server.start();
        out.heartbeat.setDaemon(true);
        out.heartbeat.start();
        events.emit(DaemonEvent.info("health.started", "Health check server listening",
                Map.of("address", "0.0.0.0:" + out.port(),
                        "liveness_path", config.livenessPath(),
                        "readiness_path", config.readinessPath())));
        return out;
    }

    public boolean enabled() {
        return server != null;
    }

    /**
     * The bound port, or -1 when disabled.
     */
    public int port() {
        return boundPort;
    }

    /**
     * Completes normally after {@link #stop()} and exceptionally with a
     * {@link HealthServerException} when the listener fails. Never completes for
     * a disabled server.
     */
    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    public void stop() {
        if (server == null || !stopped.compareAndSet(false, true)) {
            return;
        }
        stopLatch.countDown();
        server.stop(0);
        try {
            heartbeat.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        terminated.complete(null);
        events.emit(DaemonEvent.info("health.stopped", "Health check server stopped", Map.of("port", port())));
    }

    void listenerFailed(Throwable cause) {
        HealthServerException failure = new HealthServerException(
                "Health check listener failed: " + cause.getMessage(), cause);
        if (terminated.completeExceptionally(failure)) {
            events.emit(DaemonEvent.error("health.failed", failure.getMessage(), Map.of("port", port())));
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        try (exchange) {
            String path = exchange.getRequestURI().getPath();
            if (!path.equals(config.livenessPath()) && !path.equals(config.readinessPath())) {
                exchange.sendResponseHeaders(404, -1);
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "GET");
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            exchange.sendResponseHeaders(200, -1);
        }
    }

    private void runHeartbeat() {
        while (true) {
            try {
                if (stopLatch.await(heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port()), PROBE_TIMEOUT_MS);
            } catch (IOException e) {
                if (stopped.get()) {
                    return;
                }
                listenerFailed(e);
                return;
            }
            events.emit(DaemonEvent.info("health.alive", "Health check listener is alive", Map.of("port", port())));
        }
    }
}
