package io.spiffehelper.source;

public class CredentialSourceException extends Exception {
    public CredentialSourceException(String message) {
        super(message);
    }

    public CredentialSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
