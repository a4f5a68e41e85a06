package net.spookly.licensegate.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import net.spookly.licensegate.TestLicenses;
import org.junit.jupiter.api.Test;

class ValidationAuditLoggerTest {
    private final Instant now = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void formatsCompletedValidation() {
        ValidationResult result = ValidationResult.valid(TestLicenses.validClaims(TestLicenses.claims(now)));

        String line = ValidationAuditLogger.format(
                ValidationEvent.completed("abcd1234", ValidationSource.REMOTE, result, 12, now));

        assertEquals("license_event type=VALIDATED key=abcd1234 source=REMOTE valid=true tier=professional"
                + " latencyMs=12 timestamp=2026-01-15T10:00:00Z", line);
    }

    @Test
    void quotesDetailAndSkipsMissingFields() {
        ValidationEvent event = ValidationEvent.fallback(ValidationEventType.PHONE_HOME_UNAVAILABLE, "abcd1234",
                ValidationReason.PHONE_HOME_FAILED, "server said \"no\"", now);

        String line = ValidationAuditLogger.format(event);

        assertTrue(line.startsWith("license_event type=PHONE_HOME_UNAVAILABLE key=abcd1234 reason=PHONE_HOME_FAILED"));
        assertTrue(line.endsWith(" detail=\"server said 'no'\""));
        assertFalse(line.contains("source="));
        assertFalse(line.contains("latencyMs="));
    }

    @Test
    void writesOneLinePerEvent() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ValidationAuditLogger logger = new ValidationAuditLogger(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        logger.onEvent(ValidationEvent.fallback(ValidationEventType.OFFLINE_CACHE_EXPIRED, "k1",
                ValidationReason.OFFLINE_CACHE_EXPIRED, null, now));
        logger.onEvent(ValidationEvent.fallback(ValidationEventType.OFFLINE_CACHE_EXPIRED, "k2",
                ValidationReason.OFFLINE_CACHE_EXPIRED, null, now));

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(2, lines.length);
        assertTrue(lines[1].contains("key=k2"));
    }
}
