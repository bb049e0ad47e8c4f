package io.spiffehelper.runtime;

/**
 * A condition that ends the daemon with a failure exit status.
 */
public final class DaemonException extends Exception {
    public DaemonException(String message) {
        super(message);
    }

    public DaemonException(String message, Throwable cause) {
        super(message, cause);
    }
}
