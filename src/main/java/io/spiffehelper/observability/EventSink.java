package io.spiffehelper.observability;

import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Destination for daemon events. Components receive a sink at construction
 * time instead of writing to the console directly.
 */
@FunctionalInterface
public interface EventSink {
    void emit(DaemonEvent event);

    /**
     * Delivers every event to each sink in order. A sink that throws is logged
     * and skipped; the remaining sinks still receive the event.
     */
    static EventSink fanOut(List<EventSink> sinks) {
        List<EventSink> targets = List.copyOf(sinks);
        return event -> {
            for (EventSink sink : targets) {
                try {
                    sink.emit(event);
                } catch (RuntimeException e) {
                    LoggerFactory.getLogger(EventSink.class)
                            .warn("Event sink failed to record [{}]: {}", event.action(), e.getMessage(), e);
                }
            }
        };
    }
}
