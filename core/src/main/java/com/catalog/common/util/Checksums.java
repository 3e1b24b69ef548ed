package com.catalog.common.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checksums in the form used by plugin descriptors: {@code "sha256:<hex>"},
 * {@code "md5:<hex>"} or a bare hex string (SHA-256).
 */
public final class Checksums {
    private Checksums() {
    }

    public static String sha256(byte[] data) {
        return digest("SHA-256", data);
    }

    /** Recomputes the digest named by {@code declared} and compares case-insensitively. */
    public static boolean matches(String declared, byte[] data) {
        if (declared == null || declared.isBlank() || data == null) return false;
        String value = declared.trim().toLowerCase(Locale.ROOT);
        String algorithm = "SHA-256";
        int colon = value.indexOf(':');
        if (colon > 0) {
            String prefix = value.substring(0, colon);
            value = value.substring(colon + 1);
            switch (prefix) {
                case "sha256": case "sha-256": algorithm = "SHA-256"; break;
                case "md5": algorithm = "MD5"; break;
                default: return false;
            }
        }
        byte[] expected;
        try {
            expected = HexFormat.of().parseHex(value);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(expected, HexFormat.of().parseHex(digest(algorithm, data)));
    }

    private static String digest(String algorithm, byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(algorithm).digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
