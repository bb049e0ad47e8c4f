package io.spiffehelper.health;

public final class HealthServerException extends Exception {
    public HealthServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
