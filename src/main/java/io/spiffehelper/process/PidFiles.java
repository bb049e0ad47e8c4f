package io.spiffehelper.process;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class PidFiles {
    private PidFiles() {
    }

    /**
     * Reads a decimal PID, ignoring surrounding whitespace. Malformed or
     * non-positive contents are reported as {@link IOException}.
     */
    public static long read(Path path) throws IOException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IOException("Failed to read PID file: " + path, e);
        }
        String trimmed = content.trim();
        long pid;
        try {
            pid = Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            throw new IOException("Failed to parse PID from file: " + path + " (content='" + abbreviate(trimmed) + "')", e);
        }
        if (pid <= 0) {
            throw new IOException("PID file " + path + " holds a non-positive PID: " + pid);
        }
        return pid;
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 32 ? raw : raw.substring(0, 32) + "...";
    }
}
