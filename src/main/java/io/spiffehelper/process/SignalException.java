package io.spiffehelper.process;

public class SignalException extends Exception {
    public SignalException(String message) {
        super(message);
    }

    public SignalException(String message, Throwable cause) {
        super(message, cause);
    }
}
