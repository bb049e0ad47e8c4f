package io.spiffehelper.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public final class Slf4jEventSink implements EventSink {
    private final Logger logger;

    public Slf4jEventSink() {
        this(LoggerFactory.getLogger("io.spiffehelper.daemon"));
    }

    public Slf4jEventSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void emit(DaemonEvent event) {
        String line = format(event);
        switch (event.level()) {
            case DEBUG -> logger.debug(line);
            case INFO -> logger.info(line);
            case WARN -> logger.warn(line);
            case ERROR -> logger.error(line);
        }
    }

    static String format(DaemonEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(event.action()).append("] ").append(event.message());
        if (!event.details().isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (Map.Entry<String, Object> entry : event.details().entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append('=').append(entry.getValue());
                first = false;
            }
            sb.append('}');
        }
        return sb.toString();
    }
}
