package io.spiffehelper.config;

public record HealthChecksConfig(
        boolean listenerEnabled,
        int bindPort,
        String livenessPath,
        String readinessPath
) {
    public static final int DEFAULT_BIND_PORT = 8080;
    public static final String DEFAULT_LIVENESS_PATH = "/health/live";
    public static final String DEFAULT_READINESS_PATH = "/health/ready";

    public HealthChecksConfig {
        if (bindPort < 0 || bindPort > 65535) {
            throw new ConfigException("health_checks.bind_port must be within 0-65535, got " + bindPort);
        }
        livenessPath = normalizePath(livenessPath, DEFAULT_LIVENESS_PATH, "liveness_path");
        readinessPath = normalizePath(readinessPath, DEFAULT_READINESS_PATH, "readiness_path");
    }

    public static HealthChecksConfig disabled() {
        return new HealthChecksConfig(false, DEFAULT_BIND_PORT, null, null);
    }

    public static HealthChecksConfig enabledOnPort(int port) {
        return new HealthChecksConfig(true, port, null, null);
    }

    public String bindAddress() {
        return "0.0.0.0:" + bindPort;
    }

    private static String normalizePath(String raw, String fallback, String field) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String value = raw.trim();
        if (!value.startsWith("/")) {
            throw new ConfigException("health_checks." + field + " must start with '/': " + raw);
        }
        return value;
    }
}
