package net.spookly.licensegate.config;

import java.nio.file.Path;

/**
 * Default values and the configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final int OFFLINE_CACHE_DAYS = 7;
    public static final int VALIDATION_CACHE_MINUTES = 5;
    public static final int PHONE_HOME_TIMEOUT_MS = 5000;
    public static final boolean MACHINE_BINDING_ENABLED = false;

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default LicenseGate config.
            # Place the vendor's RSA public key at %s before starting.
            license:
              key: env:LICENSEGATE_LICENSE_KEY
              publicKey: path:%s

            # Uncomment to reconcile licenses with the licensing authority.
            # phoneHome:
            #   serverUrl: https://license.example.com
            #   timeoutMs: %d

            machineBinding:
              enabled: %s

            cache:
              dir: cache
              offlineDays: %d
              validationMinutes: %d
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml(String publicKeyPath) {
        if (publicKeyPath == null || publicKeyPath.isBlank()) {
            throw new ConfigException("Public key path is required for the default config");
        }
        return DEFAULT_YAML_TEMPLATE.formatted(
                publicKeyPath,
                publicKeyPath,
                PHONE_HOME_TIMEOUT_MS,
                MACHINE_BINDING_ENABLED,
                OFFLINE_CACHE_DAYS,
                VALIDATION_CACHE_MINUTES
        );
    }

    /**
     * Cache directory used when {@code cache.dir} is not configured.
     */
    public static Path cacheDir() {
        return Path.of(System.getProperty("user.home"), ".licensegate", "cache");
    }
}
