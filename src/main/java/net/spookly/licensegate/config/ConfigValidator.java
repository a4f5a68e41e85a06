package net.spookly.licensegate.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

import net.spookly.licensegate.token.PemKeys;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(LicenseGateConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateLicense(config, errors);
        validatePhoneHome(config, errors);
        validateCache(config, errors);

        throwIfErrors(errors);
    }

    private static void validateLicense(LicenseGateConfig config, List<String> errors) {
        LicenseGateConfig.LicenseConfig license = config.license;
        if (license == null) {
            errors.add("license section is required");
            return;
        }
        requireNonBlank(errors, license.key, "license.key");
        requireNonBlank(errors, license.publicKey, "license.publicKey");
        if (!isBlank(license.publicKey)) {
            try {
                PemKeys.parsePublicKey(license.publicKey);
            } catch (IllegalArgumentException e) {
                errors.add("license.publicKey is not a valid RSA public key: " + e.getMessage());
            }
        }
    }

    private static void validatePhoneHome(LicenseGateConfig config, List<String> errors) {
        LicenseGateConfig.PhoneHomeConfig phoneHome = config.phoneHome;
        if (phoneHome == null) {
            return;
        }
        if (!isBlank(phoneHome.serverUrl) && !isHttpUrl(phoneHome.serverUrl)) {
            errors.add("phoneHome.serverUrl must be an absolute http or https URL");
        }
        requirePositiveIfSet(errors, phoneHome.timeoutMs, "phoneHome.timeoutMs");
    }

    private static void validateCache(LicenseGateConfig config, List<String> errors) {
        LicenseGateConfig.CacheConfig cache = config.cache;
        if (cache == null) {
            return;
        }
        if (cache.dir != null && cache.dir.isBlank()) {
            errors.add("cache.dir must not be blank when set");
        }
        requirePositiveIfSet(errors, cache.offlineDays, "cache.offlineDays");
        requirePositiveIfSet(errors, cache.validationMinutes, "cache.validationMinutes");
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositiveIfSet(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
