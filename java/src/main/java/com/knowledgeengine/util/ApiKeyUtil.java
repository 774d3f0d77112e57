package com.knowledgeengine.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;

/**
 * Utility class for bearer key hashing and comparison.
 */
public class ApiKeyUtil {

    private static final int PREFIX_LENGTH = 7;

    /**
     * Hash an API key using SHA-256.
     *
     * @param apiKey The API key to hash
     * @return Lower-case hex SHA-256 digest of the key
     */
    public static String hashApiKey(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    /**
     * Get the first characters of a key, safe to log.
     *
     * @param apiKey The API key
     * @return Key prefix, or an empty string for short keys
     */
    public static String getKeyPrefix(String apiKey) {
        if (apiKey == null || apiKey.length() < PREFIX_LENGTH) {
            return "";
        }
        return apiKey.substring(0, PREFIX_LENGTH);
    }

    /**
     * Check a presented key against configured digests in constant time per digest.
     */
    public static boolean matches(String apiKey, Collection<String> acceptedHashes) {
        if (apiKey == null || apiKey.isEmpty() || acceptedHashes == null) {
            return false;
        }
        byte[] presented = hashApiKey(apiKey).getBytes(StandardCharsets.US_ASCII);
        boolean matched = false;
        for (String accepted : acceptedHashes) {
            if (accepted == null) {
                continue;
            }
            byte[] candidate = accepted.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII);
            matched |= MessageDigest.isEqual(presented, candidate);
        }
        return matched;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
