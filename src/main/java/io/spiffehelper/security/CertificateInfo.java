package io.spiffehelper.security;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Identity facts about a certificate used in log events: serial, fingerprint,
 * subject, and expiry.
 */
public final class CertificateInfo {
    private CertificateInfo() {
    }

    public static String serialHex(X509Certificate certificate) {
        return normalizeSerialToken(certificate.getSerialNumber().toString(16));
    }

    // Accepts "0x"-prefixed, colon- or space-separated forms so serials from openssl output compare equal.
    public static String normalizeSerialToken(String raw) {
        String cleaned = compactHex(raw);
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("serial token is empty");
        }
        validateHex(cleaned, "serial");
        return new BigInteger(cleaned, 16).toString(16).toUpperCase(Locale.ROOT);
    }

    public static String fingerprintSha256(X509Certificate certificate) {
        try {
            byte[] encoded = certificate.getEncoded();
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(encoded);
            return HexFormat.of().withUpperCase().formatHex(digest);
        } catch (Exception e) {
            throw new RuntimeException("failed to compute certificate fingerprint", e);
        }
    }

    public static Map<String, Object> describe(X509Certificate certificate) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("serial", serialHex(certificate));
        out.put("fingerprint_sha256", fingerprintSha256(certificate));
        out.put("subject", certificate.getSubjectX500Principal().getName());
        out.put("expires", certificate.getNotAfter().toInstant().toString());
        return out;
    }

    private static String compactHex(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        if (value.startsWith("0x") || value.startsWith("0X")) {
            value = value.substring(2);
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == ':' || ch == ' ' || ch == '-') {
                continue;
            }
            sb.append(Character.toUpperCase(ch));
        }
        return sb.toString();
    }

    private static void validateHex(String value, String fieldName) {
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = (ch >= '0' && ch <= '9') || (ch >= 'A' && ch <= 'F');
            if (!ok) {
                throw new IllegalArgumentException("invalid hex in " + fieldName + ": " + value);
            }
        }
    }
}
