package io.spiffehelper.source;

/**
 * Startup could not obtain a credential source, either because the failure
 * was not retryable or because every attempt was used up.
 */
public final class ConnectorException extends Exception {
    private final int attempts;

    public ConnectorException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
