package io.spiffehelper.process;

import java.util.Locale;

/**
 * Signals that may be sent to dependent processes after a rotation.
 */
public enum RenewSignal {
    HUP,
    INT,
    QUIT,
    TERM,
    USR1,
    USR2,
    WINCH;

    /**
     * Accepts "SIGHUP" and "HUP" forms, case-insensitive, ignoring surrounding whitespace.
     */
    public static RenewSignal parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Unknown signal name: null");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        String bare = normalized.startsWith("SIG") ? normalized.substring(3) : normalized;
        for (RenewSignal signal : values()) {
            if (signal.name().equals(bare)) {
                return signal;
            }
        }
        throw new IllegalArgumentException("Unknown signal name: " + name);
    }

    public String signalName() {
        return "SIG" + name();
    }
}
