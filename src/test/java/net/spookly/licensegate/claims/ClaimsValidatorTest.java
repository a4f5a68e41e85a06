package net.spookly.licensegate.claims;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;
import net.spookly.licensegate.TestLicenses;
import org.junit.jupiter.api.Test;

class ClaimsValidatorTest {
    private final Instant now = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void buildsImmutableClaims() throws Exception {
        ObjectNode node = TestLicenses.claims(now);
        node.put("machine_id", "abc123");
        node.put("unexpected", "ignored");
        ((ObjectNode) node.get("limits")).put("max_widgets", 3);

        LicenseClaims claims = ClaimsValidator.validate(node);

        assertEquals("licensegate-test", claims.issuer());
        assertEquals("cust-001", claims.subject());
        assertEquals(LicenseTier.PROFESSIONAL, claims.tier());
        assertEquals(List.of("drift-rag-advanced", "inference-engine"), List.copyOf(claims.features()));
        assertEquals(10L, claims.limits().get(LicenseLimit.MAX_TENANTS));
        assertEquals(3, claims.limits().size());
        assertEquals("abc123", claims.machineId());
        assertTrue(claims.hasMachineBinding());
        assertThrows(UnsupportedOperationException.class, () -> claims.features().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> claims.limits().clear());
    }

    @Test
    void parsesRawBytes() throws Exception {
        LicenseClaims claims = ClaimsValidator.validate(TestLicenses.json(TestLicenses.claims(now).toString()));

        assertNull(claims.machineId());
        assertFalse(claims.hasMachineBinding());
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(TestLicenses.json("{not json")));
        assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(TestLicenses.json("[]")));
        assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(new byte[0]));
    }

    @Test
    void reportsEveryViolation() {
        ObjectNode node = TestLicenses.claims(now);
        node.remove("iss");
        node.put("tier", "platinum");
        node.putArray("features");
        node.put("contact", "not-an-email");

        ClaimsSchemaException exception = assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(node));

        assertEquals(4, exception.violations().size());
        assertTrue(exception.violations().contains("iss is required"));
        assertTrue(exception.getMessage().contains("tier must be one of"));
        assertTrue(exception.getMessage().contains("features must not be empty"));
        assertTrue(exception.getMessage().contains("contact must be an e-mail address"));
    }

    @Test
    void rejectsWrongTypes() {
        ObjectNode node = TestLicenses.claims(now);
        node.put("iat", "yesterday");
        node.put("exp", 1.5);
        node.put("company", 42);

        ClaimsSchemaException exception = assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(node));

        assertTrue(exception.violations().contains("iat must be an integer"));
        assertTrue(exception.violations().contains("exp must be an integer"));
        assertTrue(exception.violations().contains("company must be a string"));
    }

    @Test
    void requiresPositiveKnownLimits() {
        ObjectNode node = TestLicenses.claims(now);
        ObjectNode limits = node.putObject("limits");
        limits.put("max_tenants", 0);
        limits.put("max_concurrent_tasks", -2);

        ClaimsSchemaException exception = assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(node));

        assertTrue(exception.violations().contains("limits.max_tenants must be greater than 0"));
        assertTrue(exception.violations().contains("limits.max_concurrent_tasks must be greater than 0"));
        assertTrue(exception.violations().contains("limits.max_tokens_per_month is required"));
    }

    @Test
    void requiresIssuedBeforeExpiry() {
        ObjectNode node = TestLicenses.claims(now);
        node.put("exp", node.get("iat").asLong());

        ClaimsSchemaException exception = assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(node));

        assertEquals(List.of("iat must be before exp"), exception.violations());
    }

    @Test
    void rejectsBlankFeatureAndMachineId() {
        ObjectNode node = TestLicenses.claims(now);
        node.putArray("features").add("ok").add(" ");
        node.put("machine_id", "");

        ClaimsSchemaException exception = assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(node));

        assertTrue(exception.violations().contains("features[1] must be a non-blank string"));
        assertTrue(exception.violations().contains("machine_id must be a non-blank string when present"));
    }

    @Test
    void tierMatchingIsExact() {
        ObjectNode node = TestLicenses.claims(now);
        node.put("tier", "Enterprise");

        assertThrows(ClaimsSchemaException.class, () -> ClaimsValidator.validate(node));
    }

    @Test
    void claimsJsonRoundTripsThroughValidator() throws Exception {
        ObjectNode node = TestLicenses.claims(now);
        node.put("machine_id", "abc123");
        LicenseClaims claims = ClaimsValidator.validate(node);

        LicenseClaims reparsed = ClaimsValidator.validate(ClaimsJson.toNode(claims));

        assertEquals(claims, reparsed);
    }
}
