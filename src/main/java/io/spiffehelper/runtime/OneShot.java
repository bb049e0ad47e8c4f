package io.spiffehelper.runtime;

import io.spiffehelper.config.HelperConfig;
import io.spiffehelper.observability.DaemonEvent;
import io.spiffehelper.observability.EventSink;
import io.spiffehelper.source.BackoffPolicy;
import io.spiffehelper.source.ConnectorException;
import io.spiffehelper.source.CredentialSource;
import io.spiffehelper.source.CredentialSourceFactory;
import io.spiffehelper.source.RetryingConnector;
import io.spiffehelper.source.Sleeper;
import io.spiffehelper.storage.CredentialWriter;

import java.io.IOException;
import java.util.Map;

/**
 * Fetches the current credentials once, writes them and returns.
 */
public final class OneShot {
    private OneShot() {
    }

    public static void run(
            HelperConfig config,
            CredentialSourceFactory sourceFactory,
            CredentialWriter writer,
            BackoffPolicy backoff,
            Sleeper sleeper,
            EventSink events
    ) throws DaemonException {
        RetryingConnector connector = new RetryingConnector(sourceFactory, backoff, sleeper, events);
        CredentialPublisher publisher = new CredentialPublisher(writer, config.addIntermediatesToBundle(),
                config.includeFederatedDomains(), events);
        try (CredentialSource source = connector.connect(config.agentAddress())) {
            publisher.publish(source.current());
        } catch (ConnectorException e) {
            throw new DaemonException(e.getMessage(), e);
        } catch (IOException | RuntimeException e) {
            throw new DaemonException("Failed to write credentials: " + e.getMessage(), e);
        }
        events.emit(DaemonEvent.info("oneshot.done", "Credentials written, exiting",
                Map.of("cert_dir", config.certDir().toString())));
    }
}
