package net.spookly.licensegate.machine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class MachineFingerprints {
    private MachineFingerprints() {
    }

    /**
     * Hash a raw platform identifier into the fingerprint format carried in {@code machine_id}.
     */
    public static String hash(String rawId) {
        if (rawId == null) {
            throw new IllegalArgumentException("rawId is required");
        }
        return HexFormat.of().formatHex(sha256(rawId.getBytes(StandardCharsets.UTF_8)));
    }

    static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
