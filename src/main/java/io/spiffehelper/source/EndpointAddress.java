package io.spiffehelper.source;

public final class EndpointAddress {
    private static final String UNIX_URL_PREFIX = "unix://";

    private EndpointAddress() {
    }

    /**
     * Rewrites {@code unix:///path} to {@code unix:/path}; anything else is
     * returned unchanged.
     */
    public static String normalize(String address) {
        if (address == null) {
            return null;
        }
        String trimmed = address.trim();
        if (trimmed.startsWith(UNIX_URL_PREFIX + "/")) {
            return "unix:" + trimmed.substring(UNIX_URL_PREFIX.length());
        }
        return trimmed;
    }
}
