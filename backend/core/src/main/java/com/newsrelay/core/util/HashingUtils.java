package com.newsrelay.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtils {
    private HashingUtils() {
    }

    public static String sha256(String value) {
        return HexFormat.of().formatHex(digest("SHA-256", value));
    }

    public static String contentChecksum(String text) {
        return sha256(TextNormalizer.collapseWhitespace(text == null ? "" : text));
    }

    private static byte[] digest(String algorithm, String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
