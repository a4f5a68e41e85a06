package net.spookly.licensegate.features;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.licensegate.claims.LicenseClaims;
import net.spookly.licensegate.claims.LicenseLimit;
import net.spookly.licensegate.claims.LicenseTier;
import net.spookly.licensegate.validation.ValidationResult;

/**
 * Read-only feature and limit queries over validated claims. Holds no resources and performs no I/O.
 */
public final class FeatureView {
    public static final int DEFAULT_EXPIRY_WARNING_DAYS = 30;
    private static final long SECONDS_PER_DAY = 86_400L;

    private final LicenseClaims claims;
    private final Clock clock;

    public FeatureView(LicenseClaims claims) {
        this(claims, Clock.systemUTC());
    }

    public FeatureView(LicenseClaims claims, Clock clock) {
        if (claims == null) {
            throw new IllegalArgumentException("claims are required");
        }
        this.claims = claims;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Build a view from a successful validation.
     *
     * @throws IllegalArgumentException when the result is not valid
     */
    public static FeatureView from(ValidationResult result) {
        if (result == null || !result.valid()) {
            throw new IllegalArgumentException("feature view requires a valid license, got " + result);
        }
        return new FeatureView(result.claims());
    }

    public boolean hasFeature(String feature) {
        return feature != null && claims.features().contains(feature);
    }

    /**
     * @throws FeatureNotEnabledException naming the feature and the current tier
     */
    public void requireFeature(String feature) {
        if (!hasFeature(feature)) {
            throw new FeatureNotEnabledException(feature, claims.tier());
        }
    }

    /**
     * Look up a limit by its claim key, for example {@code max_tenants}.
     *
     * @throws UnknownLimitException listing the available keys
     */
    public long getLimit(String key) {
        LicenseLimit limit = LicenseLimit.fromKey(key);
        if (limit == null || !claims.limits().containsKey(limit)) {
            throw new UnknownLimitException(key, new ArrayList<>(limits().keySet()));
        }
        return claims.limits().get(limit);
    }

    public long getLimit(LicenseLimit limit) {
        Long value = limit == null ? null : claims.limits().get(limit);
        if (value == null) {
            throw new UnknownLimitException(limit == null ? null : limit.key(), new ArrayList<>(limits().keySet()));
        }
        return value;
    }

    /**
     * Whole days left before expiry, rounded down; negative once expired.
     */
    public long daysUntilExpiration() {
        long remaining = claims.expiresAt() - clock.instant().getEpochSecond();
        return Math.floorDiv(remaining, SECONDS_PER_DAY);
    }

    public boolean isExpiringSoon() {
        return isExpiringSoon(DEFAULT_EXPIRY_WARNING_DAYS);
    }

    public boolean isExpiringSoon(int thresholdDays) {
        return daysUntilExpiration() <= thresholdDays;
    }

    public LicenseTier tier() {
        return claims.tier();
    }

    public Set<String> features() {
        return claims.features();
    }

    /**
     * Limits keyed by their claim key.
     */
    public Map<String, Long> limits() {
        Map<String, Long> limits = new LinkedHashMap<>();
        for (Map.Entry<LicenseLimit, Long> entry : claims.limits().entrySet()) {
            limits.put(entry.getKey().key(), entry.getValue());
        }
        return limits;
    }

    public CustomerInfo customerInfo() {
        return new CustomerInfo(claims.company(), claims.contact(), claims.subject());
    }

    public Instant expiresAt() {
        return claims.expiresAtInstant();
    }

    @Value
    @Accessors(fluent = true)
    public static class CustomerInfo {
        String company;
        String contact;
        String customerId;
    }
}
