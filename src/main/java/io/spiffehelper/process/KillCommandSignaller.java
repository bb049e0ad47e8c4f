package io.spiffehelper.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Delivers signals through the shell's {@code kill} builtin. The signal name
 * and PID travel as positional parameters, never as interpolated script text.
 */
public final class KillCommandSignaller implements ProcessSignaller {
    private static final int MAX_ERROR_CHARS = 512;
    private static final String SCRIPT = "kill -s \"$1\" \"$2\"";

    private final String shell;
    private final long timeoutMs;

    public KillCommandSignaller() {
        this("/bin/sh", Duration.ofSeconds(5));
    }

    public KillCommandSignaller(String shell, Duration timeout) {
        if (shell == null || shell.isBlank()) {
            throw new IllegalArgumentException("signaller shell cannot be empty");
        }
        this.shell = shell;
        this.timeoutMs = Math.max(100L, timeout.toMillis());
    }

    @Override
    public void send(long pid, RenewSignal signal) throws SignalException {
        if (pid <= 0) {
            throw new SignalException("Refusing to signal non-positive PID " + pid);
        }
        ProcessBuilder pb = new ProcessBuilder(List.of(shell, "-c", SCRIPT, "kill", signal.name(), Long.toString(pid)));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SignalException("Failed to send signal " + signal.signalName() + " to process " + pid
                    + ": kill spawn failed: " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new SignalException("Failed to send signal " + signal.signalName() + " to process " + pid
                        + ": kill timed out after " + Duration.ofMillis(timeoutMs));
            }
            if (process.exitValue() != 0) {
                String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
                throw new SignalException("Failed to send signal " + signal.signalName() + " to process " + pid
                        + ": exit=" + process.exitValue() + " output=" + truncate(output));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SignalException("Interrupted while signaling process " + pid, e);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new SignalException("Failed to send signal " + signal.signalName() + " to process " + pid, e);
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
