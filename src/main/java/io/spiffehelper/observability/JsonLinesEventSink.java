package io.spiffehelper.observability;

import io.spiffehelper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one compact JSON object per event to a file, for log shippers that
 * prefer structured input over the human-readable log. A failed append is
 * logged and dropped; the daemon keeps running without that event line.
 */
public final class JsonLinesEventSink implements EventSink {
    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesEventSink.class);

    private final Path eventFile;
    private final String component;

    public JsonLinesEventSink(Path eventFile, String component) {
        this.eventFile = eventFile;
        this.component = component == null || component.isBlank() ? "spiffe-helper" : component.trim();
        try {
            Path parent = eventFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(eventFile, "", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize event log file: " + eventFile, e);
        }
    }

    @Override
    public synchronized void emit(DaemonEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", event.timestamp().toString());
        row.put("component", component);
        row.put("level", event.level().name());
        row.put("action", event.action());
        row.put("message", event.message());
        row.put("details", stringifyValues(event.details()));
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(eventFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            LOG.warn("Failed to write event log {} for [{}]: {}", eventFile, event.action(), e.getMessage());
        }
    }

    public Path eventFile() {
        return eventFile;
    }

    private Map<String, Object> stringifyValues(Map<String, Object> details) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : details.entrySet()) {
            Object value = entry.getValue();
            boolean plain = value == null
                    || value instanceof Number
                    || value instanceof Boolean
                    || value instanceof String;
            out.put(entry.getKey(), plain ? value : String.valueOf(value));
        }
        return out;
    }
}
