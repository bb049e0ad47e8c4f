package io.spiffehelper.storage;

import io.spiffehelper.model.Credential;
import io.spiffehelper.model.TrustBundle;

import java.io.IOException;

/**
 * Persists credentials and trust bundles. The two writes are independent: a
 * failed bundle write leaves an already written credential in place.
 */
public interface CredentialWriter {
    void writeCredential(Credential credential) throws IOException;

    /**
     * Writes the bundle, or does nothing when this writer has no bundle
     * destination configured.
     */
    void writeBundle(TrustBundle bundle) throws IOException;
}
