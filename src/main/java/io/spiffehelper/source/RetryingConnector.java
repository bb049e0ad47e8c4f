package io.spiffehelper.source;

import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opens a {@link CredentialSource}, retrying transient failures with
 * exponential backoff. Blocks the caller until a session exists or the
 * attempt budget is spent.
 */
public final class RetryingConnector {
    private final CredentialSourceFactory factory;
    private final BackoffPolicy policy;
    private final Sleeper sleeper;
    private final EventSink events;

    public RetryingConnector(CredentialSourceFactory factory, EventSink events) {
        this(factory, BackoffPolicy.defaults(), Sleeper.SYSTEM, events);
    }

    public RetryingConnector(CredentialSourceFactory factory, BackoffPolicy policy, Sleeper sleeper, EventSink events) {
        this.factory = factory;
        this.policy = policy;
        this.sleeper = sleeper;
        this.events = events;
    }

    public CredentialSource connect(String address) throws ConnectorException {
        String endpoint = EndpointAddress.normalize(address);
        int attempt = 0;
        while (true) {
            attempt++;
            CredentialSourceException failure;
            try {
                CredentialSource source = factory.create(endpoint);
                events.emit(DaemonEvent.info("connector.connected", "Connected to Workload API",
                        Map.of("address", endpoint, "attempts", attempt)));
                return source;
            } catch (CredentialSourceException e) {
                failure = e;
            }
            if (!RetryClassifier.isRetryable(failure)) {
                events.emit(DaemonEvent.error("connector.fatal", "Failed to connect to Workload API: " + failure.getMessage(),
                        Map.of("address", endpoint, "attempts", attempt)));
                throw new ConnectorException("Failed to create X509Source: " + failure.getMessage(), attempt, failure);
            }
            if (attempt >= policy.maxAttempts()) {
                events.emit(DaemonEvent.error("connector.exhausted",
                        "Giving up on Workload API after " + attempt + " attempts: " + failure.getMessage(),
                        Map.of("address", endpoint, "attempts", attempt)));
                throw new ConnectorException("Failed to create X509Source after " + attempt + " attempts: "
                        + failure.getMessage(), attempt, failure);
            }
            Duration delay = policy.delayAfterAttempt(attempt);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("address", endpoint);
            details.put("attempt", attempt);
            details.put("max_attempts", policy.maxAttempts());
            details.put("retry_in_ms", delay.toMillis());
            events.emit(DaemonEvent.warn("connector.retry",
                    "Workload API not ready, retrying in " + delay.toMillis() + "ms: " + failure.getMessage(), details));
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectorException("Interrupted while waiting to reconnect to Workload API", attempt, e);
            }
        }
    }
}
