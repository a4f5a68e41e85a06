package net.spookly.licensegate;

import net.spookly.licensegate.config.ConfigException;
import net.spookly.licensegate.config.LicenseGateConfig;
import net.spookly.licensegate.features.FeatureView;
import net.spookly.licensegate.validation.LicenseValidator;
import net.spookly.licensegate.validation.ValidationEventListener;
import net.spookly.licensegate.validation.ValidationResult;

/**
 * Optional process-wide holder for one validator and the feature view of the configured license.
 * Applications that manage their own {@link LicenseValidator} do not need it.
 */
public final class LicenseGate {
    private static LicenseValidator validator;
    private static FeatureView features;

    private LicenseGate() {
    }

    public static ValidationResult initialize(LicenseGateConfig config) {
        return initialize(config, ValidationEventListener.NOOP);
    }

    /**
     * Validate the configured license and publish its feature view.
     *
     * @throws LicenseException when the license is not valid
     * @throws ConfigException when the configuration cannot build a validator
     */
    public static synchronized ValidationResult initialize(LicenseGateConfig config, ValidationEventListener listener) {
        if (config == null || config.license == null) {
            throw new ConfigException("license section is required");
        }
        LicenseValidator created = new LicenseValidator(config, listener);
        ValidationResult result = created.validate(config.license.key);
        validator = created;
        if (!result.valid()) {
            features = null;
            String detail = result.detail() == null ? "" : " (" + result.detail() + ")";
            throw new LicenseException("License validation failed: " + result.reason() + detail, result);
        }
        features = FeatureView.from(result);
        return result;
    }

    /**
     * @throws LicenseException when no valid license has been initialized
     */
    public static synchronized FeatureView features() {
        if (features == null) {
            throw new LicenseException("License not initialized. Call LicenseGate.initialize() first.");
        }
        return features;
    }

    /**
     * False until a valid license has been initialized.
     */
    public static synchronized boolean hasFeature(String feature) {
        return features != null && features.hasFeature(feature);
    }

    public static synchronized LicenseValidator validator() {
        if (validator == null) {
            throw new LicenseException("License not initialized. Call LicenseGate.initialize() first.");
        }
        return validator;
    }

    public static synchronized void reset() {
        validator = null;
        features = null;
    }
}
