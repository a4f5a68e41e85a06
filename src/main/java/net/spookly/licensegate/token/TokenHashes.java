package net.spookly.licensegate.token;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way cache keys for raw tokens.
 */
public final class TokenHashes {
    private TokenHashes() {
    }

    /**
     * Lowercase hex SHA-256 of the raw token string.
     */
    public static String sha256Hex(String token) {
        if (token == null) {
            throw new IllegalArgumentException("token is required");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
