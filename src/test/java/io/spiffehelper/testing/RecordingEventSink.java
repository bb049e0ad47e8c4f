package io.spiffehelper.testing;

import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingEventSink implements EventSink {
    private final List<DaemonEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(DaemonEvent event) {
        events.add(event);
    }

    public List<DaemonEvent> events() {
        return List.copyOf(events);
    }

    public List<DaemonEvent> withAction(String action) {
        List<DaemonEvent> out = new ArrayList<>();
        for (DaemonEvent event : events) {
            if (event.action().equals(action)) {
                out.add(event);
            }
        }
        return out;
    }

    public boolean has(String action) {
        return !withAction(action).isEmpty();
    }

    public long count(String action) {
        return withAction(action).size();
    }
}
