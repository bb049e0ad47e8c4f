package io.spiffehelper.config;

import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

public final class FileModes {
    public static final int MAX_MODE = 0777;

    private static final PosixFilePermission[] BIT_ORDER = {
            PosixFilePermission.OTHERS_EXECUTE,
            PosixFilePermission.OTHERS_WRITE,
            PosixFilePermission.OTHERS_READ,
            PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.GROUP_WRITE,
            PosixFilePermission.GROUP_READ,
            PosixFilePermission.OWNER_EXECUTE,
            PosixFilePermission.OWNER_WRITE,
            PosixFilePermission.OWNER_READ
    };

    private FileModes() {
    }

    /**
     * Parses a permission mode. A leading {@code 0} selects octal ("0644"),
     * anything else is read as decimal ("420").
     */
    public static int parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigException("file mode cannot be empty");
        }
        String trimmed = raw.trim();
        int mode;
        try {
            if (trimmed.startsWith("0") && trimmed.length() > 1) {
                mode = Integer.parseInt(trimmed, 8);
            } else {
                mode = Integer.parseInt(trimmed);
            }
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid file mode '" + raw + "'", e);
        }
        if (mode < 0 || mode > MAX_MODE) {
            throw new ConfigException("File mode '" + raw + "' is out of range (must be 0-0777)");
        }
        return mode;
    }

    public static Set<PosixFilePermission> toPermissions(int mode) {
        Set<PosixFilePermission> out = EnumSet.noneOf(PosixFilePermission.class);
        for (int bit = 0; bit < BIT_ORDER.length; bit++) {
            if ((mode & (1 << bit)) != 0) {
                out.add(BIT_ORDER[bit]);
            }
        }
        return out;
    }

    public static String toOctal(int mode) {
        return String.format("%04o", mode);
    }
}
