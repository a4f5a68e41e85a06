package net.spookly.licensegate.validation;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import net.spookly.licensegate.claims.LicenseClaims;

/**
 * Outcome of one validation attempt. Claims are kept on invalid results whenever they were
 * already schema-validated, so diagnostics can still show tier and company.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationResult {
    private final boolean valid;
    /** {@code null} when valid. */
    private final ValidationReason reason;
    private final String detail;
    private final LicenseClaims claims;

    public static ValidationResult valid(LicenseClaims claims) {
        if (claims == null) {
            throw new IllegalArgumentException("claims are required for a valid result");
        }
        return new ValidationResult(true, null, null, claims);
    }

    public static ValidationResult invalid(ValidationReason reason, String detail) {
        return invalid(reason, detail, null);
    }

    public static ValidationResult invalid(ValidationReason reason, String detail, LicenseClaims claims) {
        if (reason == null) {
            throw new IllegalArgumentException("reason is required for an invalid result");
        }
        return new ValidationResult(false, reason, detail, claims);
    }

    @Override
    public String toString() {
        if (valid) {
            return "ValidationResult(valid, tier=" + claims.tier() + ")";
        }
        return "ValidationResult(invalid, reason=" + reason + (detail == null ? "" : ", detail=" + detail) + ")";
    }
}
