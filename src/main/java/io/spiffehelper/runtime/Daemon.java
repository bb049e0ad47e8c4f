package io.spiffehelper.runtime;

import io.spiffehelper.config.HelperConfig;
import io.spiffehelper.health.HealthCheckServer;
import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;
import io.spiffehelper.process.ChildSupervisor;
import io.spiffehelper.process.ManagedChild;
import io.spiffehelper.process.ProcessSignaller;
import io.spiffehelper.process.SignalDispatcher;
import io.spiffehelper.source.ConnectorException;
import io.spiffehelper.source.CredentialSource;
import io.spiffehelper.source.CredentialSourceFactory;
import io.spiffehelper.source.RetryingConnector;
import io.spiffehelper.source.UpdateChannel;
import io.spiffehelper.storage.CredentialWriter;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the helper in daemon mode.
 *
 * <p>Startup connects to the Workload API, writes the first snapshot, spawns
 * the managed command and starts the health listener. The daemon then runs
 * until an OS termination request, loss of the Workload API session or a
 * health listener failure. Teardown cancels every activity, waits for them in
 * order (heartbeat, child supervisor, update watcher) and stops the health
 * listener. The first failure observed is what {@link #run()} reports.
 */
public final class Daemon {
    private final HelperConfig config;
    private final CredentialSourceFactory sourceFactory;
    private final CredentialPublisher publisher;
    private final ProcessSignaller signaller;
    private final DaemonTimings timings;
    private final EventSink events;

    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final CompletableFuture<Void> started = new CompletableFuture<>();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicReference<DaemonException> firstFailure = new AtomicReference<>();
    private volatile HealthCheckServer healthServer;

    public Daemon(
            HelperConfig config,
            CredentialSourceFactory sourceFactory,
            CredentialWriter writer,
            ProcessSignaller signaller,
            DaemonTimings timings,
            EventSink events
    ) {
        this.config = config;
        this.sourceFactory = sourceFactory;
        this.publisher = new CredentialPublisher(writer, config.addIntermediatesToBundle(),
                config.includeFederatedDomains(), events);
        this.signaller = signaller;
        this.timings = timings == null ? DaemonTimings.defaults() : timings;
        this.events = events;
    }

    /**
     * Asks a running or starting daemon to shut down gracefully. Safe to call
     * from any thread, any number of times.
     */
    public void requestTermination() {
        termination.complete(null);
    }

    /**
     * Completes once every activity has been launched.
     */
    public CompletableFuture<Void> started() {
        return started.copy();
    }

    HealthCheckServer healthServer() {
        return healthServer;
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runs until shutdown.
     *
     * @throws DaemonException on any startup failure or fatal runtime condition
     */
    public void run() throws DaemonException {
        try {
            events.emit(DaemonEvent.info("daemon.starting", "Connecting to agent",
                    Map.of("agent_address", config.agentAddress())));
            RetryingConnector connector = new RetryingConnector(sourceFactory, timings.backoff(),
                    this::sleepUnlessTerminated, events);
            CredentialSource source;
            try {
                source = connector.connect(config.agentAddress());
            } catch (ConnectorException e) {
                if (termination.isDone()) {
                    // The backoff sleep was cut short by the request, not by a real interrupt.
                    Thread.interrupted();
                    events.emit(DaemonEvent.info("daemon.stopped", "Termination requested during startup",
                            Map.of("attempts", e.attempts())));
                    return;
                }
                throw new DaemonException(e.getMessage(), e);
            }
            try {
                runWithSource(source);
            } finally {
                source.close();
            }
        } finally {
            started.completeExceptionally(new IllegalStateException("daemon did not start"));
            stopped.countDown();
        }
    }

    private void runWithSource(CredentialSource source) throws DaemonException {
        UpdateChannel.Receiver updates = source.updates();
        try {
            publisher.publish(source.current());
        } catch (IOException | RuntimeException e) {
            throw new DaemonException("Failed to write initial credentials: " + e.getMessage(), e);
        }

        ShutdownSignal shutdown = new ShutdownSignal();
        ManagedChild child = spawnChild();
        ChildSupervisor supervisor = child == null
                ? null
                : new ChildSupervisor(child, shutdown, timings.childStopGrace(), events);

        HealthCheckServer health;
        try {
            health = HealthCheckServer.start(config.healthChecks(), timings.healthHeartbeatInterval(), events);
        } catch (IOException e) {
            if (supervisor != null) {
                supervisor.stop();
            }
            throw new DaemonException(e.getMessage(), e);
        }

        SignalDispatcher dispatcher = new SignalDispatcher(config.renewSignal(), child, config.pidFile(), signaller,
                events);
        UpdateWatcher watcher = new UpdateWatcher(source, updates, publisher, dispatcher, shutdown, failure -> {
            recordFailure(failure);
            shutdown.cancel();
        }, events);

        healthServer = health;
        Thread watcherThread = startActivity("spiffe-helper-watcher", watcher, shutdown);
        Thread heartbeatThread = startActivity("spiffe-helper-heartbeat",
                new LivenessHeartbeat(shutdown, timings.livenessInterval(), events), shutdown);
        Thread supervisorThread = supervisor == null
                ? null
                : startActivity("spiffe-helper-child", supervisor, shutdown);
        try {
            events.emit(DaemonEvent.info("daemon.started", "spiffe-helper is running", startedDetails(child, health)));
            started.complete(null);

            CompletableFuture.anyOf(termination, health.terminated(), shutdown.whenCancelled())
                    .handle((value, error) -> null)
                    .join();
            if (termination.isDone()) {
                events.emit(DaemonEvent.info("daemon.terminating", "Received termination request, shutting down",
                        Map.of()));
            } else if (health.terminated().isCompletedExceptionally()) {
                Throwable cause = health.terminated().handle((value, error) -> error).join();
                recordFailure(new DaemonException("Health check server failed: " + cause.getMessage(), cause));
            }
        } catch (RuntimeException e) {
            recordFailure(new DaemonException("Daemon failed: " + e.getMessage(), e));
        } finally {
            shutdown.cancel();
            join(heartbeatThread);
            join(supervisorThread);
            join(watcherThread);
            health.stop();
        }

        DaemonException failure = firstFailure.get();
        if (failure != null) {
            events.emit(DaemonEvent.error("daemon.failed", "spiffe-helper stopped with an error: " + failure.getMessage(),
                    Map.of()));
            throw failure;
        }
        events.emit(DaemonEvent.info("daemon.stopped", "spiffe-helper stopped", Map.of()));
    }

    private ManagedChild spawnChild() throws DaemonException {
        if (config.cmd() == null) {
            return null;
        }
        ManagedChild child;
        try {
            child = ManagedChild.spawn(config.cmd(), config.cmdArgs());
        } catch (IOException e) {
            throw new DaemonException(e.getMessage(), e);
        }
        events.emit(DaemonEvent.info("child.started", "Started managed process",
                Map.of("pid", child.currentPid(), "command", child.commandLine())));
        return child;
    }

    private Map<String, Object> startedDetails(ManagedChild child, HealthCheckServer health) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("cert_dir", config.certDir().toString());
        details.put("renew_signal", config.renewSignal() == null ? null : config.renewSignal().signalName());
        details.put("child_pid", child == null ? null : child.currentPid());
        details.put("health_port", health.enabled() ? health.port() : null);
        return details;
    }

    private void recordFailure(DaemonException failure) {
        firstFailure.compareAndSet(null, failure);
    }

    private void sleepUnlessTerminated(Duration delay) throws InterruptedException {
        try {
            termination.get(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return;
        } catch (ExecutionException e) {
            throw new IllegalStateException("termination future failed", e);
        }
        throw new InterruptedException("termination requested");
    }

    // An activity that dies unexpectedly ends the run with a failure instead of vanishing.
    private Thread startActivity(String name, Runnable activity, ShutdownSignal shutdown) {
        Thread thread = new Thread(() -> {
            try {
                activity.run();
            } catch (RuntimeException e) {
                recordFailure(new DaemonException(name + " failed: " + e.getMessage(), e));
                shutdown.cancel();
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void join(Thread thread) {
        if (thread == null) {
            return;
        }
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
