package io.spiffehelper.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Routes SIGTERM and SIGINT to a graceful daemon shutdown so the process can
 * exit with status 0. A JVM shutdown hook covers every other way the JVM is
 * asked to stop.
 */
public final class OsSignals {
    private static final Logger LOG = LoggerFactory.getLogger(OsSignals.class);
    private static final List<String> TERMINATION_SIGNALS = List.of("TERM", "INT");

    private OsSignals() {
    }

    public static void install(Daemon daemon, Duration shutdownGrace) {
        handle(TERMINATION_SIGNALS, daemon::requestTermination);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            daemon.requestTermination();
            try {
                daemon.awaitStopped(shutdownGrace);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "spiffe-helper-shutdown-hook"));
    }

    /**
     * @return the signal names a handler was installed for
     */
    static List<String> handle(List<String> names, Runnable onSignal) {
        List<String> handled = new ArrayList<>();
        for (String name : names) {
            try {
                Signal.handle(new Signal(name), signal -> onSignal.run());
                handled.add(name);
            } catch (IllegalArgumentException e) {
                LOG.warn("Cannot handle SIG{}, relying on the shutdown hook: {}", name, e.getMessage());
            }
        }
        return handled;
    }
}
