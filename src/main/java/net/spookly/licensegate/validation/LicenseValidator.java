package net.spookly.licensegate.validation;

import java.nio.file.Path;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import net.spookly.licensegate.cache.CacheLookup;
import net.spookly.licensegate.cache.MemoryValidationCache;
import net.spookly.licensegate.cache.OfflineCacheStore;
import net.spookly.licensegate.claims.ClaimsSchemaException;
import net.spookly.licensegate.claims.ClaimsValidator;
import net.spookly.licensegate.claims.LicenseClaims;
import net.spookly.licensegate.claims.TemporalStatus;
import net.spookly.licensegate.claims.TemporalValidator;
import net.spookly.licensegate.config.ConfigDefaults;
import net.spookly.licensegate.config.ConfigException;
import net.spookly.licensegate.config.LicenseGateConfig;
import net.spookly.licensegate.machine.MachineIdentityException;
import net.spookly.licensegate.machine.MachineIdentityProvider;
import net.spookly.licensegate.machine.PlatformMachineIdentityProvider;
import net.spookly.licensegate.remote.HttpPhoneHomeClient;
import net.spookly.licensegate.remote.PhoneHomeClient;
import net.spookly.licensegate.remote.PhoneHomeException;
import net.spookly.licensegate.remote.PhoneHomeResponse;
import net.spookly.licensegate.token.LicenseToken;
import net.spookly.licensegate.token.PemKeys;
import net.spookly.licensegate.token.SignatureVerifier;
import net.spookly.licensegate.token.TokenCodec;
import net.spookly.licensegate.token.TokenFormatException;
import net.spookly.licensegate.token.TokenHashes;
import net.spookly.licensegate.token.TokenRedactor;

/**
 * Validates license tokens and owns both result caches.
 *
 * <p>Steps run in order and each may end the call: memory cache lookup, decode, signature,
 * schema, time window, machine binding, phone-home with offline fallback, then persist.
 * Local failures are returned immediately and never cached. A valid result, or a rejection by
 * the licensing authority, is written to both caches before it is returned.
 *
 * <p>{@link #validate(String)} never throws. Concurrent calls are safe; concurrent misses for the
 * same token each run the full pipeline and the last cache write wins.
 */
public final class LicenseValidator {
    private final SignatureVerifier verifier;
    private final PhoneHomeClient phoneHome;
    private final boolean machineBinding;
    private final MachineIdentityProvider machineIdentity;
    private final OfflineCacheStore offlineStore;
    private final MemoryValidationCache memoryCache;
    private final LicenseMetrics metrics;
    private final ValidationEventListener eventListener;
    private final Clock clock;

    /**
     * Build a validator from loaded configuration.
     */
    public LicenseValidator(LicenseGateConfig config, ValidationEventListener eventListener) {
        this(config, eventListener, Clock.systemUTC());
    }

    LicenseValidator(LicenseGateConfig config, ValidationEventListener eventListener, Clock clock) {
        this(
                parsePublicKey(config),
                phoneHomeClient(config),
                machineBindingEnabled(config),
                new PlatformMachineIdentityProvider(),
                new OfflineCacheStore(cacheDir(config), offlineDays(config), clock),
                new MemoryValidationCache(validationMinutes(config), clock),
                eventListener,
                clock
        );
    }

    LicenseValidator(PublicKey publicKey,
                     PhoneHomeClient phoneHome,
                     boolean machineBinding,
                     MachineIdentityProvider machineIdentity,
                     OfflineCacheStore offlineStore,
                     MemoryValidationCache memoryCache,
                     ValidationEventListener eventListener,
                     Clock clock) {
        if (publicKey == null) {
            throw new ConfigException("Public key is required for license validation");
        }
        if (offlineStore == null || memoryCache == null) {
            throw new ConfigException("Both cache layers are required for license validation");
        }
        if (machineBinding && machineIdentity == null) {
            throw new ConfigException("Machine identity provider is required when machine binding is enabled");
        }
        this.verifier = new SignatureVerifier(publicKey);
        this.phoneHome = phoneHome;
        this.machineBinding = machineBinding;
        this.machineIdentity = machineIdentity;
        this.offlineStore = offlineStore;
        this.memoryCache = memoryCache;
        this.metrics = new LicenseMetrics();
        this.eventListener = eventListener == null ? ValidationEventListener.NOOP : eventListener;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Validate a license token. Expected failures are reported in the result, never thrown.
     */
    public ValidationResult validate(String token) {
        long start = System.nanoTime();
        String cacheKey = null;
        Outcome outcome;
        try {
            if (token == null || token.isBlank()) {
                outcome = Outcome.local(ValidationResult.invalid(ValidationReason.INVALID_FORMAT, "token is empty"));
            } else {
                cacheKey = TokenHashes.sha256Hex(token);
                Optional<ValidationResult> cached = memoryCache.get(cacheKey);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    outcome = new Outcome(cached.get(), ValidationSource.MEMORY_CACHE);
                } else {
                    metrics.recordCacheMiss();
                    outcome = runPipeline(token, cacheKey);
                }
            }
        } catch (RuntimeException e) {
            System.err.println("Unexpected license validation failure for key "
                    + TokenRedactor.shortKey(cacheKey) + ": " + e);
            outcome = Outcome.local(ValidationResult.invalid(ValidationReason.INVALID_FORMAT,
                    "unexpected validation failure"));
        }
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        metrics.recordValidation(outcome.result, latencyMs);
        emit(ValidationEvent.completed(TokenRedactor.shortKey(cacheKey), outcome.source, outcome.result,
                latencyMs, clock.instant()));
        return outcome.result;
    }

    /**
     * Drop every cached result, in memory and on disk.
     */
    public void clearCache() {
        memoryCache.clear();
        offlineStore.clearAll();
    }

    public LicenseMetrics metrics() {
        return metrics;
    }

    private Outcome runPipeline(String token, String cacheKey) {
        LicenseToken decoded;
        try {
            decoded = TokenCodec.decode(token);
        } catch (TokenFormatException e) {
            return Outcome.local(ValidationResult.invalid(ValidationReason.INVALID_FORMAT, e.getMessage()));
        }
        if (!verifier.verify(decoded)) {
            return Outcome.local(ValidationResult.invalid(ValidationReason.INVALID_SIGNATURE,
                    "signature verification failed"));
        }
        LicenseClaims claims;
        try {
            claims = ClaimsValidator.validate(decoded.claimsBytes());
        } catch (ClaimsSchemaException e) {
            return Outcome.local(ValidationResult.invalid(ValidationReason.INVALID_SCHEMA, e.getMessage()));
        }
        TemporalStatus temporal = TemporalValidator.check(claims, clock.instant());
        if (temporal == TemporalStatus.NOT_YET_VALID) {
            return Outcome.local(ValidationResult.invalid(ValidationReason.NOT_YET_VALID,
                    "license is not valid before " + claims.issuedAtInstant(), claims));
        }
        if (temporal == TemporalStatus.EXPIRED) {
            return Outcome.local(ValidationResult.invalid(ValidationReason.EXPIRED,
                    "license expired at " + claims.expiresAtInstant(), claims));
        }

        String fingerprint = null;
        if (machineBinding) {
            try {
                fingerprint = machineIdentity.currentFingerprint();
            } catch (MachineIdentityException e) {
                if (claims.hasMachineBinding()) {
                    return Outcome.local(ValidationResult.invalid(ValidationReason.MACHINE_MISMATCH,
                            "machine identity unavailable: " + e.getMessage(), claims));
                }
                System.err.println("Machine identity unavailable, phoning home without it: " + e.getMessage());
            }
            if (claims.hasMachineBinding() && !claims.machineId().equalsIgnoreCase(fingerprint)) {
                return Outcome.local(ValidationResult.invalid(ValidationReason.MACHINE_MISMATCH,
                        "license is bound to another machine", claims));
            }
        }

        ValidationResult local = ValidationResult.valid(claims);
        if (phoneHome == null) {
            persist(token, cacheKey, local);
            return Outcome.local(local);
        }
        return reconcile(token, cacheKey, fingerprint, local);
    }

    private Outcome reconcile(String token, String cacheKey, String fingerprint, ValidationResult local) {
        long start = System.nanoTime();
        PhoneHomeResponse response;
        try {
            response = phoneHome.check(token, fingerprint);
        } catch (PhoneHomeException e) {
            metrics.recordPhoneHome(false, elapsedMs(start));
            return fallBackOffline(token, cacheKey, e, local);
        }
        metrics.recordPhoneHome(response.valid(), elapsedMs(start));
        ValidationResult result;
        if (response.valid()) {
            result = local;
        } else {
            String reason = response.reason() == null ? "license rejected by licensing authority" : response.reason();
            result = ValidationResult.invalid(ValidationReason.PHONE_HOME_FAILED, reason, local.claims());
        }
        persist(token, cacheKey, result);
        return new Outcome(result, ValidationSource.REMOTE);
    }

    private Outcome fallBackOffline(String token, String cacheKey, PhoneHomeException failure, ValidationResult local) {
        String shortKey = TokenRedactor.shortKey(cacheKey);
        emit(ValidationEvent.fallback(ValidationEventType.PHONE_HOME_UNAVAILABLE, shortKey,
                ValidationReason.PHONE_HOME_FAILED, failure.kind() + ": " + failure.getMessage(), clock.instant()));
        metrics.recordOfflineMode();
        CacheLookup lookup = offlineStore.lookup(token);
        if (lookup.isHit()) {
            memoryCache.put(cacheKey, lookup.result());
            return new Outcome(lookup.result(), ValidationSource.OFFLINE_CACHE);
        }
        if (lookup.status() == CacheLookup.Status.EXPIRED) {
            metrics.recordReason(ValidationReason.OFFLINE_CACHE_EXPIRED);
            emit(ValidationEvent.fallback(ValidationEventType.OFFLINE_CACHE_EXPIRED, shortKey,
                    ValidationReason.OFFLINE_CACHE_EXPIRED, null, clock.instant()));
        }
        // Local checks already passed, so the locally derived result stands.
        persist(token, cacheKey, local);
        return Outcome.local(local);
    }

    private void persist(String token, String cacheKey, ValidationResult result) {
        offlineStore.put(token, result);
        memoryCache.put(cacheKey, result);
    }

    private void emit(ValidationEvent event) {
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException e) {
            System.err.println("Failed to emit license audit event: " + e.getMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static PublicKey parsePublicKey(LicenseGateConfig config) {
        if (config == null || config.license == null) {
            throw new ConfigException("license section is required");
        }
        try {
            return PemKeys.parsePublicKey(config.license.publicKey);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("license.publicKey is not a valid RSA public key: " + e.getMessage(), e);
        }
    }

    private static PhoneHomeClient phoneHomeClient(LicenseGateConfig config) {
        LicenseGateConfig.PhoneHomeConfig phoneHome = config.phoneHome;
        if (phoneHome == null || phoneHome.serverUrl == null || phoneHome.serverUrl.isBlank()) {
            return null;
        }
        int timeoutMs = phoneHome.timeoutMs != null ? phoneHome.timeoutMs : ConfigDefaults.PHONE_HOME_TIMEOUT_MS;
        return new HttpPhoneHomeClient(phoneHome.serverUrl, timeoutMs);
    }

    private static boolean machineBindingEnabled(LicenseGateConfig config) {
        return config.machineBinding != null && config.machineBinding.enabled != null
                ? config.machineBinding.enabled
                : ConfigDefaults.MACHINE_BINDING_ENABLED;
    }

    private static Path cacheDir(LicenseGateConfig config) {
        if (config.cache == null || config.cache.dir == null) {
            return ConfigDefaults.cacheDir();
        }
        return Path.of(config.cache.dir);
    }

    private static int offlineDays(LicenseGateConfig config) {
        return config.cache != null && config.cache.offlineDays != null
                ? config.cache.offlineDays
                : ConfigDefaults.OFFLINE_CACHE_DAYS;
    }

    private static int validationMinutes(LicenseGateConfig config) {
        return config.cache != null && config.cache.validationMinutes != null
                ? config.cache.validationMinutes
                : ConfigDefaults.VALIDATION_CACHE_MINUTES;
    }

    private static final class Outcome {
        private final ValidationResult result;
        private final ValidationSource source;

        private Outcome(ValidationResult result, ValidationSource source) {
            this.result = result;
            this.source = source;
        }

        private static Outcome local(ValidationResult result) {
            return new Outcome(result, ValidationSource.LOCAL);
        }
    }
}
