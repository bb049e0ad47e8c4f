package io.spiffehelper.source;

import io.spiffehelper.model.CredentialSnapshot;

/**
 * A live session with the identity issuance endpoint.
 */
public interface CredentialSource extends AutoCloseable {
    /**
     * The most recent snapshot delivered by the endpoint.
     */
    CredentialSnapshot current();

    /**
     * A receiver notified on each new snapshot. The receiver fails with
     * {@link UpdateChannelClosedException} when the session is lost.
     */
    UpdateChannel.Receiver updates();

    @Override
    void close();
}
