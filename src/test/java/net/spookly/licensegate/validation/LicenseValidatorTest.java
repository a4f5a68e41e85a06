package net.spookly.licensegate.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.node.ObjectNode;
import net.spookly.licensegate.MutableClock;
import net.spookly.licensegate.TestLicenses;
import net.spookly.licensegate.cache.MemoryValidationCache;
import net.spookly.licensegate.cache.OfflineCacheStore;
import net.spookly.licensegate.claims.LicenseTier;
import net.spookly.licensegate.machine.MachineFingerprints;
import net.spookly.licensegate.machine.MachineIdentityException;
import net.spookly.licensegate.machine.MachineIdentityProvider;
import net.spookly.licensegate.remote.PhoneHomeClient;
import net.spookly.licensegate.remote.PhoneHomeException;
import net.spookly.licensegate.remote.PhoneHomeResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LicenseValidatorTest {
    private static final PhoneHomeClient UNREACHABLE = (token, machineId) -> {
        throw new PhoneHomeException(PhoneHomeException.Kind.NETWORK_ERROR, "connection refused");
    };

    private final Instant now = Instant.parse("2026-01-15T10:00:00Z");
    private final MutableClock clock = new MutableClock(now);
    private final List<ValidationEvent> events = Collections.synchronizedList(new ArrayList<>());

    @TempDir
    Path cacheDir;

    @Test
    void acceptsSignedUnexpiredToken() {
        LicenseValidator validator = validator(null, false, null);

        ValidationResult result = validator.validate(TestLicenses.sign(TestLicenses.claims(now)));

        assertTrue(result.valid());
        assertNull(result.reason());
        assertEquals(LicenseTier.PROFESSIONAL, result.claims().tier());
        assertEquals(ValidationSource.LOCAL, lastCompleted().source());
        assertEquals(1, cacheFileCount());
    }

    @Test
    void flippedPayloadByteFailsSignature() {
        String token = TestLicenses.sign(TestLicenses.claims(now));
        String[] parts = token.split("\\.");
        byte[] claims = Base64.getUrlDecoder().decode(parts[1]);
        claims[claims.length / 2] ^= 0x01;
        String tampered = parts[0] + "." + Base64.getUrlEncoder().withoutPadding().encodeToString(claims) + "." + parts[2];

        ValidationResult result = validator(null, false, null).validate(tampered);

        assertFalse(result.valid());
        assertEquals(ValidationReason.INVALID_SIGNATURE, result.reason());
        assertNull(result.claims());
    }

    @Test
    void tokenFromAnotherIssuerFailsSignature() {
        String token = TestLicenses.sign(TestLicenses.claims(now), TestLicenses.generateKeyPair().getPrivate());

        ValidationResult result = validator(null, false, null).validate(token);

        assertEquals(ValidationReason.INVALID_SIGNATURE, result.reason());
        assertEquals(0, cacheFileCount());
    }

    @Test
    void malformedTokensAreInvalidFormat() {
        LicenseValidator validator = validator(null, false, null);

        assertEquals(ValidationReason.INVALID_FORMAT, validator.validate("not-a-token").reason());
        assertEquals(ValidationReason.INVALID_FORMAT, validator.validate("a.b").reason());
        assertEquals(ValidationReason.INVALID_FORMAT, validator.validate("").reason());
        assertEquals(ValidationReason.INVALID_FORMAT, validator.validate(null).reason());
        assertEquals(ValidationReason.INVALID_FORMAT, validator.validate("!!!.@@@.###").reason());
        assertEquals(0, cacheFileCount());
    }

    @Test
    void signedButMalformedClaimsAreInvalidSchema() {
        ObjectNode claims = TestLicenses.claims(now);
        claims.put("tier", "platinum");

        ValidationResult result = validator(null, false, null).validate(TestLicenses.sign(claims));

        assertEquals(ValidationReason.INVALID_SCHEMA, result.reason());
        assertTrue(result.detail().contains("tier"));
    }

    @Test
    void secondValidationIsServedFromMemory() {
        LicenseValidator validator = validator(null, false, null);
        String token = TestLicenses.sign(TestLicenses.claims(now));

        ValidationResult first = validator.validate(token);
        ValidationResult second = validator.validate(token);

        assertSame(first, second);
        assertEquals(1, validator.metrics().cacheHits());
        assertEquals(1, validator.metrics().cacheMisses());
        assertEquals(ValidationSource.MEMORY_CACHE, lastCompleted().source());
    }

    @Test
    void expiryIsCheckedAgainstClock() {
        LicenseValidator validator = validator(null, false, null);
        ObjectNode expired = TestLicenses.claims(now);
        expired.put("exp", now.getEpochSecond() - 1);
        ObjectNode longLived = TestLicenses.claims(now);
        longLived.put("exp", now.plus(Duration.ofDays(365)).getEpochSecond());

        ValidationResult expiredResult = validator.validate(TestLicenses.sign(expired));
        ValidationResult validResult = validator.validate(TestLicenses.sign(longLived));

        assertEquals(ValidationReason.EXPIRED, expiredResult.reason());
        assertNotNull(expiredResult.claims());
        assertEquals("Acme Corp", expiredResult.claims().company());
        assertTrue(validResult.valid());
    }

    @Test
    void expiredResultIsNotCached() {
        LicenseValidator validator = validator(null, false, null);
        ObjectNode expired = TestLicenses.claims(now);
        expired.put("exp", now.getEpochSecond() - 1);
        String token = TestLicenses.sign(expired);

        validator.validate(token);
        validator.validate(token);

        assertEquals(0, validator.metrics().cacheHits());
        assertEquals(0, cacheFileCount());
    }

    @Test
    void futureIssuanceIsNotYetValid() {
        ObjectNode claims = TestLicenses.claims(now);
        claims.put("iat", now.getEpochSecond() + 3600);

        ValidationResult result = validator(null, false, null).validate(TestLicenses.sign(claims));

        assertEquals(ValidationReason.NOT_YET_VALID, result.reason());
        assertNotNull(result.claims());
    }

    @Test
    void unreachableAuthorityStillYieldsValid() {
        LicenseValidator validator = validator(UNREACHABLE, false, null);

        ValidationResult result = validator.validate(TestLicenses.sign(TestLicenses.claims(now)));

        assertTrue(result.valid());
        assertEquals(1, validator.metrics().phoneHomeFailure());
        assertEquals(1, validator.metrics().offlineModeUsage());
        assertTrue(events.stream().anyMatch(event -> event.type() == ValidationEventType.PHONE_HOME_UNAVAILABLE));
        assertEquals(1, cacheFileCount());
    }

    @Test
    void remoteRejectionIsReturnedAndCached() {
        AtomicInteger calls = new AtomicInteger();
        PhoneHomeClient rejecting = (token, machineId) -> {
            calls.incrementAndGet();
            return new PhoneHomeResponse(false, "license revoked", null);
        };
        LicenseValidator validator = validator(rejecting, false, null);
        String token = TestLicenses.sign(TestLicenses.claims(now));

        ValidationResult result = validator.validate(token);
        ValidationResult again = validator.validate(token);

        assertFalse(result.valid());
        assertEquals(ValidationReason.PHONE_HOME_FAILED, result.reason());
        assertEquals("license revoked", result.detail());
        assertNotNull(result.claims());
        assertSame(result, again);
        assertEquals(1, calls.get());
        assertEquals(1, cacheFileCount());
    }

    @Test
    void remoteAcceptanceIsReportedAsRemote() {
        LicenseValidator validator = validator((token, machineId) -> new PhoneHomeResponse(true, null, null), false, null);

        ValidationResult result = validator.validate(TestLicenses.sign(TestLicenses.claims(now)));

        assertTrue(result.valid());
        assertEquals(ValidationSource.REMOTE, lastCompleted().source());
        assertEquals(1, validator.metrics().phoneHomeSuccess());
    }

    @Test
    void offlineCacheIsUsedWhenAuthorityIsUnreachable() {
        String token = TestLicenses.sign(TestLicenses.claims(now));
        validator((t, machineId) -> new PhoneHomeResponse(false, "license revoked", null), false, null).validate(token);

        LicenseValidator restarted = validator(UNREACHABLE, false, null);
        ValidationResult result = restarted.validate(token);

        assertEquals(ValidationReason.PHONE_HOME_FAILED, result.reason());
        assertEquals("license revoked", result.detail());
        assertEquals(ValidationSource.OFFLINE_CACHE, lastCompleted().source());
    }

    @Test
    void expiredOfflineEntryFallsThroughToLocalResult() {
        String token = TestLicenses.sign(TestLicenses.claims(now));
        validator((t, machineId) -> new PhoneHomeResponse(false, "license revoked", null), false, null).validate(token);
        clock.advance(Duration.ofDays(8));

        LicenseValidator restarted = validator(UNREACHABLE, false, null);
        ValidationResult result = restarted.validate(token);

        assertTrue(result.valid());
        assertEquals(1L, restarted.metrics().failureCountsByReason().get(ValidationReason.OFFLINE_CACHE_EXPIRED));
        assertTrue(events.stream().anyMatch(event -> event.type() == ValidationEventType.OFFLINE_CACHE_EXPIRED));
    }

    @Test
    void memoryEntryExpiresAfterValidationWindow() {
        AtomicInteger calls = new AtomicInteger();
        LicenseValidator validator = validator((token, machineId) -> {
            calls.incrementAndGet();
            return new PhoneHomeResponse(true, null, null);
        }, false, null);
        String token = TestLicenses.sign(TestLicenses.claims(now));

        validator.validate(token);
        clock.advance(Duration.ofMinutes(6));
        validator.validate(token);

        assertEquals(2, calls.get());
    }

    @Test
    void machineBindingRejectsOtherMachine() {
        ObjectNode claims = TestLicenses.claims(now);
        claims.put("machine_id", MachineFingerprints.hash("machine-a"));
        String token = TestLicenses.sign(claims);

        ValidationResult mismatch = validator(null, true, () -> MachineFingerprints.hash("machine-b")).validate(token);

        assertEquals(ValidationReason.MACHINE_MISMATCH, mismatch.reason());
        assertNotNull(mismatch.claims());
    }

    @Test
    void machineBindingAcceptsSameMachine() {
        ObjectNode claims = TestLicenses.claims(now);
        claims.put("machine_id", MachineFingerprints.hash("machine-a"));

        ValidationResult result = validator(null, true, () -> MachineFingerprints.hash("machine-a"))
                .validate(TestLicenses.sign(claims));

        assertTrue(result.valid());
    }

    @Test
    void machineBindingIsSkippedWhenDisabled() {
        ObjectNode claims = TestLicenses.claims(now);
        claims.put("machine_id", MachineFingerprints.hash("machine-a"));

        ValidationResult result = validator(null, false, () -> MachineFingerprints.hash("machine-b"))
                .validate(TestLicenses.sign(claims));

        assertTrue(result.valid());
    }

    @Test
    void unavailableMachineIdentityIsMismatch() {
        ObjectNode claims = TestLicenses.claims(now);
        claims.put("machine_id", MachineFingerprints.hash("machine-a"));
        MachineIdentityProvider failing = () -> {
            throw new MachineIdentityException("no identifier");
        };

        ValidationResult result = validator(null, true, failing).validate(TestLicenses.sign(claims));

        assertEquals(ValidationReason.MACHINE_MISMATCH, result.reason());
    }

    @Test
    void fingerprintIsSentWhenBindingIsEnabled() {
        AtomicReference<String> sent = new AtomicReference<>();
        PhoneHomeClient recording = (token, machineId) -> {
            sent.set(machineId);
            return new PhoneHomeResponse(true, null, null);
        };
        String fingerprint = MachineFingerprints.hash("machine-a");

        validator(recording, true, () -> fingerprint).validate(TestLicenses.sign(TestLicenses.claims(now)));

        assertEquals(fingerprint, sent.get());
    }

    @Test
    void clearCacheDropsBothLayers() {
        LicenseValidator validator = validator(null, false, null);
        String token = TestLicenses.sign(TestLicenses.claims(now));
        validator.validate(token);

        validator.clearCache();
        validator.validate(token);

        assertEquals(0, validator.metrics().cacheHits());
        assertEquals(2, validator.metrics().cacheMisses());
    }

    @Test
    void failingListenerDoesNotBreakValidation() {
        LicenseValidator validator = new LicenseValidator(
                TestLicenses.issuerKeys().getPublic(),
                null,
                false,
                null,
                new OfflineCacheStore(cacheDir, 7, clock),
                new MemoryValidationCache(5, clock),
                event -> {
                    throw new IllegalStateException("listener down");
                },
                clock
        );

        assertTrue(validator.validate(TestLicenses.sign(TestLicenses.claims(now))).valid());
    }

    @Test
    void unexpectedRemoteFailureIsReportedNotThrown() {
        PhoneHomeClient broken = (token, machineId) -> {
            throw new IllegalStateException("bug");
        };

        ValidationResult result = validator(broken, false, null).validate(TestLicenses.sign(TestLicenses.claims(now)));

        assertFalse(result.valid());
        assertEquals(ValidationReason.INVALID_FORMAT, result.reason());
    }

    @Test
    void concurrentValidationsAgree() throws Exception {
        LicenseValidator validator = validator(null, false, null);
        String token = TestLicenses.sign(TestLicenses.claims(now));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ValidationResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                tasks.add(() -> validator.validate(token));
            }
            for (Future<ValidationResult> future : executor.invokeAll(tasks)) {
                assertTrue(future.get().valid());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(32, validator.metrics().validations());
    }

    private LicenseValidator validator(PhoneHomeClient phoneHome, boolean binding, MachineIdentityProvider identity) {
        return new LicenseValidator(
                TestLicenses.issuerKeys().getPublic(),
                phoneHome,
                binding,
                identity,
                new OfflineCacheStore(cacheDir, 7, clock),
                new MemoryValidationCache(5, clock),
                events::add,
                clock
        );
    }

    private ValidationEvent lastCompleted() {
        ValidationEvent last = null;
        for (ValidationEvent event : events) {
            if (event.type() == ValidationEventType.VALIDATED) {
                last = event;
            }
        }
        return last;
    }

    private long cacheFileCount() {
        try (Stream<Path> files = Files.list(cacheDir)) {
            return files.filter(path -> path.getFileName().toString().endsWith(".json")).count();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
