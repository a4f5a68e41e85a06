package net.spookly.licensegate.token;

import java.nio.charset.StandardCharsets;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Decoded segments of a license token. The claims are still raw bytes at this point.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public final class LicenseToken {
    /** Header algorithm, always {@code RS256} once decoded. */
    private final String algorithm;
    /** Header type, {@code null} when the issuer omitted it. */
    private final String type;
    private final String encodedHeader;
    private final String encodedClaims;
    private final byte[] claimsBytes;
    private final byte[] signature;

    /**
     * Bytes covered by the signature: the header and claims segments exactly as received.
     */
    public byte[] signingInput() {
        return (encodedHeader + "." + encodedClaims).getBytes(StandardCharsets.US_ASCII);
    }
}
