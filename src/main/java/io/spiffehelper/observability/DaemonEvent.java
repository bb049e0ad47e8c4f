package io.spiffehelper.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DaemonEvent(
        Instant timestamp,
        Level level,
        String action,
        String message,
        Map<String, Object> details
) {
    public enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    public DaemonEvent {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("event action cannot be empty");
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
        level = level == null ? Level.INFO : level;
        message = message == null ? "" : message;
        // Detail values may be null, so Map.copyOf is not an option here.
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static DaemonEvent debug(String action, String message, Map<String, Object> details) {
        return new DaemonEvent(Instant.now(), Level.DEBUG, action, message, details);
    }

    public static DaemonEvent info(String action, String message, Map<String, Object> details) {
        return new DaemonEvent(Instant.now(), Level.INFO, action, message, details);
    }

    public static DaemonEvent info(String action, String message) {
        return info(action, message, Map.of());
    }

    public static DaemonEvent warn(String action, String message, Map<String, Object> details) {
        return new DaemonEvent(Instant.now(), Level.WARN, action, message, details);
    }

    public static DaemonEvent error(String action, String message, Map<String, Object> details) {
        return new DaemonEvent(Instant.now(), Level.ERROR, action, message, details);
    }

    public Object detail(String key) {
        return details.get(key);
    }
}
