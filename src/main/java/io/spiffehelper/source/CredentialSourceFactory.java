package io.spiffehelper.source;

@FunctionalInterface
public interface CredentialSourceFactory {
    /**
     * Opens a session and blocks until the first snapshot is available.
     */
    CredentialSource create(String address) throws CredentialSourceException;
}
