package io.spiffehelper.source;

import java.io.FileNotFoundException;
import java.net.ConnectException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides whether a failed connection attempt is worth repeating. Permission
 * denied (the agent has not attested the workload yet), connection refused and
 * a missing socket are transient while the agent starts up; everything else is
 * treated as permanent.
 */
public final class RetryClassifier {
    // Whole tokens only: "NotFound" must not match inside "ClassNotFoundException".
    private static final List<Pattern> RETRYABLE_MARKERS = List.of(
            Pattern.compile("\\bpermission[ _]?denied\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bconnection[ _]?refused\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bnot[ _]?found\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bno such file\\b", Pattern.CASE_INSENSITIVE)
    );

    private RetryClassifier() {
    }

    public static boolean isRetryable(Throwable error) {
        Map<Throwable, Boolean> visited = new IdentityHashMap<>();
        Throwable current = error;
        while (current != null && visited.put(current, Boolean.TRUE) == null) {
            if (isRetryableType(current) || hasRetryableMessage(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isRetryableType(Throwable error) {
        return error instanceof ConnectException
                || error instanceof NoSuchFileException
                || error instanceof FileNotFoundException
                || error instanceof AccessDeniedException;
    }

    private static boolean hasRetryableMessage(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return false;
        }
        for (Pattern marker : RETRYABLE_MARKERS) {
            if (marker.matcher(message).find()) {
                return true;
            }
        }
        return false;
    }
}
