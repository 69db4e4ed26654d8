package net.deckadvisor.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 hashing for content fingerprints.
 */
public final class HashUtils {

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the lower-case hex SHA-256 digest of a UTF-8 string.
     *
     * @param data string to hash
     * @return 64-character hex digest
     */
    public static String sha256Hex(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available on this JVM", e);
        }
    }
}
