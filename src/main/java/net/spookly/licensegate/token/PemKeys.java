package net.spookly.licensegate.token;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Parses PEM encoded RSA public keys.
 */
public final class PemKeys {
    private static final String BEGIN = "-----BEGIN PUBLIC KEY-----";
    private static final String END = "-----END PUBLIC KEY-----";

    private PemKeys() {
    }

    /**
     * Parse an X.509 SubjectPublicKeyInfo PEM block into an RSA public key.
     *
     * @throws IllegalArgumentException when the PEM block is malformed or not an RSA key
     */
    public static RSAPublicKey parsePublicKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("public key is empty");
        }
        String trimmed = pem.strip();
        int begin = trimmed.indexOf(BEGIN);
        int end = trimmed.indexOf(END);
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("expected a '" + BEGIN + "' block");
        }
        String base64 = trimmed.substring(begin + BEGIN.length(), end).replaceAll("\\s+", "");
        byte[] der;
        try {
            der = Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("public key body is not valid base64", e);
        }
        try {
            PublicKey key = KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
            return (RSAPublicKey) key;
        } catch (GeneralSecurityException | ClassCastException e) {
            throw new IllegalArgumentException("public key is not an RSA key", e);
        }
    }

    /**
     * Render a public key as a PEM block.
     */
    public static String toPem(PublicKey key) {
        String body = Base64.getMimeEncoder(64, new byte[]{'\n'}).encodeToString(key.getEncoded());
        return BEGIN + "\n" + body + "\n" + END + "\n";
    }
}
