package com.flagrank.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Flag and capture-proof comparison.
 */
public final class FlagMatcher {

    private FlagMatcher() {
    }

    public static boolean matches(String submitted, String expected, boolean caseSensitive) {
        if (submitted == null || expected == null) {
            return false;
        }
        return normalize(submitted, caseSensitive).equals(normalize(expected, caseSensitive));
    }

    public static String normalize(String value, boolean caseSensitive) {
        String trimmed = value.trim();
        return caseSensitive ? trimmed : trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * SHA-256 of the case-insensitive normal form, hex encoded.
     */
    public static String digest(String value) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(normalize(value, false).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
