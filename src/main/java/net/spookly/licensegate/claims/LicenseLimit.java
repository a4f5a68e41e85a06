package net.spookly.licensegate.claims;

/**
 * Quota keys carried in the {@code limits} claim.
 */
public enum LicenseLimit {
    MAX_TENANTS("max_tenants"),
    MAX_CONCURRENT_TASKS("max_concurrent_tasks"),
    MAX_TOKENS_PER_MONTH("max_tokens_per_month");

    private final String key;

    LicenseLimit(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static LicenseLimit fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (LicenseLimit limit : values()) {
            if (limit.key.equals(key)) {
                return limit;
            }
        }
        return null;
    }
}
