package net.spookly.licensegate.claims;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Schema-validated license claims. Instances are only created by {@link ClaimsValidator}.
 */
@Value
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class LicenseClaims {
    /** Issuer ({@code iss}). */
    String issuer;
    /** Customer id ({@code sub}). */
    String subject;
    /** Issuance time in epoch seconds ({@code iat}). */
    long issuedAt;
    /** Expiry time in epoch seconds ({@code exp}). */
    long expiresAt;
    LicenseTier tier;
    /** Unmodifiable, in claim order. */
    Set<String> features;
    /** Unmodifiable; every {@link LicenseLimit} is present. */
    Map<LicenseLimit, Long> limits;
    /** Hashed machine fingerprint the license is bound to, or {@code null}. */
    String machineId;
    String company;
    String contact;

    public Instant issuedAtInstant() {
        return Instant.ofEpochSecond(issuedAt);
    }

    public Instant expiresAtInstant() {
        return Instant.ofEpochSecond(expiresAt);
    }

    public boolean hasMachineBinding() {
        return machineId != null;
    }
}
