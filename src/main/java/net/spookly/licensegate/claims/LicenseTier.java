package net.spookly.licensegate.claims;

/**
 * Commercial license tiers.
 */
public enum LicenseTier {
    STARTER("starter"),
    PROFESSIONAL("professional"),
    ENTERPRISE("enterprise");

    private final String wireName;

    LicenseTier(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a tier from its claim value; matching is exact (lower case).
     */
    public static LicenseTier fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (LicenseTier tier : values()) {
            if (tier.wireName.equals(value)) {
                return tier;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
