package com.williamcallahan.film_rating_aggregator.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hashing helpers for cache keys.
 *
 * @author William Callahan
 */
public final class HashUtils {

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the MD5 digest of a UTF-8 string as lowercase hex.
     *
     * @param data String to hash
     * @return 32 character hex string
     */
    public static String md5Hex(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return bytesToHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships MD5
            throw new IllegalStateException("MD5 algorithm unavailable", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
