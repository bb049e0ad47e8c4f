package io.spiffehelper.source;

/**
 * Raised through an update receiver once the credential source has lost its
 * session. The channel never reopens.
 */
public final class UpdateChannelClosedException extends RuntimeException {
    public UpdateChannelClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
