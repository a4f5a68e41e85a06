package net.spookly.licensegate.token;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Objects;

/**
 * Verifies RS256 (RSA PKCS#1 v1.5 with SHA-256) license signatures.
 */
public final class SignatureVerifier {
    private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

    private final PublicKey publicKey;

    public SignatureVerifier(PublicKey publicKey) {
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
    }

    /**
     * Verify the token's signature over its encoded header and claims segments.
     */
    public boolean verify(LicenseToken token) {
        if (token == null) {
            return false;
        }
        return verify(token.signingInput(), token.signature());
    }

    /**
     * Verify a detached signature; any verification error counts as a mismatch.
     */
    public boolean verify(byte[] data, byte[] signature) {
        if (data == null || signature == null || signature.length == 0) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(data);
            return verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }
}
