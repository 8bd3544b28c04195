package com.projectpulse.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashingUtils {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HashingUtils() {
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            char[] out = new char[hashed.length * 2];
            for (int i = 0; i < hashed.length; i++) {
                out[i * 2] = HEX[(hashed[i] >> 4) & 0x0f];
                out[i * 2 + 1] = HEX[hashed[i] & 0x0f];
            }
            return new String(out);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
