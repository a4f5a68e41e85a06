package net.spookly.licensegate.config;

public class LicenseGateConfig {
    public LicenseConfig license;
    public PhoneHomeConfig phoneHome;
    public MachineBindingConfig machineBinding;
    public CacheConfig cache;

    public static class LicenseConfig {
        /**
         * Signed license token presented at startup.
         */
        public String key;
        /**
         * RSA public key (PEM, SubjectPublicKeyInfo) used to verify license signatures.
         */
        public String publicKey;
    }

    public static class PhoneHomeConfig {
        /**
         * Base URL of the licensing authority. Absent means offline-only validation.
         */
        public String serverUrl;
        public Integer timeoutMs;
    }

    public static class MachineBindingConfig {
        public Boolean enabled;
    }

    public static class CacheConfig {
        public String dir;
        public Integer offlineDays;
        public Integer validationMinutes;
    }
}
