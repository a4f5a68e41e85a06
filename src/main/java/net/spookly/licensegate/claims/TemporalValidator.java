package net.spookly.licensegate.claims;

import java.time.Instant;

/**
 * Checks claims against the issuance and expiry window.
 */
public final class TemporalValidator {
    private TemporalValidator() {
    }

    public static TemporalStatus check(LicenseClaims claims, Instant now) {
        long seconds = now.getEpochSecond();
        if (seconds < claims.issuedAt()) {
            return TemporalStatus.NOT_YET_VALID;
        }
        if (seconds > claims.expiresAt()) {
            return TemporalStatus.EXPIRED;
        }
        return TemporalStatus.VALID;
    }
}
