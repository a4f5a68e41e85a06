package net.spookly.licensegate.features;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.licensegate.claims.LicenseTier;

/**
 * Raised when code requires a feature the current license does not grant.
 */
@Getter
@Accessors(fluent = true)
public class FeatureNotEnabledException extends RuntimeException {
    private final String feature;
    private final LicenseTier tier;

    public FeatureNotEnabledException(String feature, LicenseTier tier) {
        super("Feature '" + feature + "' is not enabled in your license. Current tier: " + tier + ".");
        this.feature = feature;
        this.tier = tier;
    }
}
