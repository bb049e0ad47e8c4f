package io.spiffehelper.process;

import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;
import io.spiffehelper.runtime.ShutdownSignal;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Watches the managed child until it exits on its own or the daemon shuts
 * down. A natural exit is reported and leaves the daemon running; on shutdown
 * the child and its descendants are terminated, escalating to a forcible kill
 * when the grace period runs out.
 */
public final class ChildSupervisor implements Runnable {
    public static final Duration DEFAULT_STOP_GRACE = Duration.ofSeconds(5);

    private final ManagedChild child;
    private final ShutdownSignal shutdown;
    private final Duration stopGrace;
    private final EventSink events;

    public ChildSupervisor(ManagedChild child, ShutdownSignal shutdown, Duration stopGrace, EventSink events) {
        this.child = child;
        this.shutdown = shutdown;
        this.stopGrace = stopGrace == null || stopGrace.isNegative() ? DEFAULT_STOP_GRACE : stopGrace;
        this.events = events;
    }

    @Override
    public void run() {
        CompletableFuture<Process> exit = child.process().onExit();
        shutdown.awaitEither(exit);
        if (exit.isDone()) {
            reportNaturalExit();
            return;
        }
        stop();
    }

    private void reportNaturalExit() {
        long pid = child.process().pid();
        child.clearPid();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pid", pid);
        details.put("command", child.command());
        details.put("exit_status", child.process().exitValue());
        events.emit(DaemonEvent.warn(
                "child.exited",
                "Managed process exited: exit status " + child.process().exitValue(),
                details
        ));
    }

    /**
     * Terminates the child. Safe to call when the child has already exited.
     */
    public void stop() {
        Process process = child.process();
        long pid = process.pid();
        if (!process.isAlive()) {
            child.clearPid();
            return;
        }
        events.emit(DaemonEvent.info("child.stopping", "Stopping managed process",
                Map.of("pid", pid, "command", child.command())));
        boolean exited;
        try {
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
            exited = process.waitFor(stopGrace.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                events.emit(DaemonEvent.warn("child.kill_escalated",
                        "Managed process ignored termination, killing forcibly",
                        Map.of("pid", pid, "grace_ms", stopGrace.toMillis())));
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                exited = process.waitFor(stopGrace.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            exited = !process.isAlive();
        } finally {
            child.clearPid();
        }
        if (exited) {
            events.emit(DaemonEvent.info("child.stopped", "Managed process stopped",
                    Map.of("pid", pid, "exit_status", process.exitValue())));
        } else {
            events.emit(DaemonEvent.error("child.stop_failed", "Managed process is still running after kill",
                    Map.of("pid", pid)));
        }
    }

    public ManagedChild child() {
        return child;
    }
}
