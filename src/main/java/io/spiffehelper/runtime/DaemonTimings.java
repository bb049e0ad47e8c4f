package io.spiffehelper.runtime;

import io.spiffehelper.health.HealthCheckServer;
import io.spiffehelper.process.ChildSupervisor;
import io.spiffehelper.source.BackoffPolicy;

import java.time.Duration;

public record DaemonTimings(
        BackoffPolicy backoff,
        Duration livenessInterval,
        Duration healthHeartbeatInterval,
        Duration childStopGrace
) {
    public DaemonTimings {
        backoff = backoff == null ? BackoffPolicy.defaults() : backoff;
        livenessInterval = positiveOr(livenessInterval, LivenessHeartbeat.DEFAULT_INTERVAL);
        healthHeartbeatInterval = positiveOr(healthHeartbeatInterval, HealthCheckServer.DEFAULT_HEARTBEAT_INTERVAL);
        childStopGrace = positiveOr(childStopGrace, ChildSupervisor.DEFAULT_STOP_GRACE);
    }

    public static DaemonTimings defaults() {
        return new DaemonTimings(null, null, null, null);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
