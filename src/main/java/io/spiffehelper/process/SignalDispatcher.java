package io.spiffehelper.process;

import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Notifies dependent processes after a successful rotation. The managed child
 * and the PID-file target are signaled independently; a failure on one side
 * is logged and never prevents the other.
 */
public final class SignalDispatcher {
    private final RenewSignal signal;
    private final ManagedChild child;
    private final Path pidFile;
    private final ProcessSignaller signaller;
    private final EventSink events;

    public SignalDispatcher(
            RenewSignal signal,
            ManagedChild child,
            Path pidFile,
            ProcessSignaller signaller,
            EventSink events
    ) {
        this.signal = signal;
        this.child = child;
        this.pidFile = pidFile;
        this.signaller = signaller;
        this.events = events;
    }

    public boolean enabled() {
        return signal != null;
    }

    public DispatchOutcome dispatch() {
        if (signal == null) {
            return DispatchOutcome.skipped();
        }
        List<String> errors = new ArrayList<>();
        boolean childSignaled = signalChild(errors);
        boolean pidFileSignaled = signalPidFile(errors);
        return new DispatchOutcome(true, childSignaled, pidFileSignaled, errors);
    }

    private boolean signalChild(List<String> errors) {
        if (child == null) {
            return false;
        }
        long pid = child.currentPid();
        if (pid == 0L) {
            events.emit(DaemonEvent.debug("signal.child_skipped", "Managed process is not running, skipping signal",
                    Map.of("signal", signal.signalName(), "command", child.command())));
            return false;
        }
        events.emit(DaemonEvent.info("signal.child",
                "Sending signal " + signal.signalName() + " to managed process (PID: " + pid + ")",
                Map.of("signal", signal.signalName(), "pid", pid)));
        try {
            signaller.send(pid, signal);
            return true;
        } catch (SignalException e) {
            errors.add(e.getMessage());
            events.emit(DaemonEvent.error("signal.child_failed", "Failed to signal managed process: " + e.getMessage(),
                    Map.of("signal", signal.signalName(), "pid", pid)));
            return false;
        }
    }

    private boolean signalPidFile(List<String> errors) {
        if (pidFile == null) {
            return false;
        }
        long pid;
        try {
            pid = PidFiles.read(pidFile);
        } catch (IOException e) {
            errors.add(e.getMessage());
            events.emit(DaemonEvent.error("signal.pid_file_unreadable",
                    "Failed to read PID from file " + pidFile + ": " + e.getMessage(),
                    Map.of("signal", signal.signalName(), "pid_file", pidFile.toString())));
            return false;
        }
        events.emit(DaemonEvent.info("signal.pid_file",
                "Sending signal " + signal.signalName() + " to process from PID file " + pidFile + " (PID: " + pid + ")",
                Map.of("signal", signal.signalName(), "pid", pid, "pid_file", pidFile.toString())));
        try {
            signaller.send(pid, signal);
            return true;
        } catch (SignalException e) {
            errors.add(e.getMessage());
            events.emit(DaemonEvent.error("signal.pid_file_failed",
                    "Failed to signal process from PID file: " + e.getMessage(),
                    Map.of("signal", signal.signalName(), "pid", pid, "pid_file", pidFile.toString())));
            return false;
        }
    }

    public record DispatchOutcome(
            boolean enabled,
            boolean childSignaled,
            boolean pidFileSignaled,
            List<String> errors
    ) {
        public DispatchOutcome {
            errors = errors == null ? List.of() : List.copyOf(errors);
        }

        static DispatchOutcome skipped() {
            return new DispatchOutcome(false, false, false, List.of());
        }
    }
}
