package net.spookly.licensegate.claims;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Validates decoded claims against the license schema and builds {@link LicenseClaims}.
 */
public final class ClaimsValidator {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private ClaimsValidator() {
    }

    /**
     * Parse and validate the raw claims segment.
     */
    public static LicenseClaims validate(byte[] raw) throws ClaimsSchemaException {
        if (raw == null || raw.length == 0) {
            throw new ClaimsSchemaException(List.of("claims are empty"));
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (IOException e) {
            throw new ClaimsSchemaException("claims are not valid JSON", e);
        }
        return validate(node);
    }

    /**
     * Validate an already parsed claims object. Every violation is reported, not just the first.
     */
    public static LicenseClaims validate(JsonNode node) throws ClaimsSchemaException {
        List<String> errors = new ArrayList<>();
        if (node == null || !node.isObject()) {
            throw new ClaimsSchemaException(List.of("claims must be a JSON object"));
        }

        String issuer = requireText(node, "iss", errors);
        String subject = requireText(node, "sub", errors);
        Long issuedAt = requireLong(node, "iat", errors);
        Long expiresAt = requireLong(node, "exp", errors);
        LicenseTier tier = requireTier(node, errors);
        Set<String> features = requireFeatures(node, errors);
        Map<LicenseLimit, Long> limits = requireLimits(node, errors);
        String machineId = optionalText(node, "machine_id", errors);
        String company = requireText(node, "company", errors);
        String contact = requireText(node, "contact", errors);

        if (contact != null && !EMAIL.matcher(contact).matches()) {
            errors.add("contact must be an e-mail address");
        }
        if (issuedAt != null && expiresAt != null && issuedAt >= expiresAt) {
            errors.add("iat must be before exp");
        }
        if (!errors.isEmpty()) {
            throw new ClaimsSchemaException(errors);
        }
        return new LicenseClaims(
                issuer,
                subject,
                issuedAt,
                expiresAt,
                tier,
                Collections.unmodifiableSet(features),
                Collections.unmodifiableMap(limits),
                machineId,
                company,
                contact
        );
    }

    private static String requireText(JsonNode node, String field, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            errors.add(field + " is required");
            return null;
        }
        if (!value.isTextual()) {
            errors.add(field + " must be a string");
            return null;
        }
        if (value.asText().isBlank()) {
            errors.add(field + " must not be blank");
            return null;
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            errors.add(field + " must be a non-blank string when present");
            return null;
        }
        return value.asText();
    }

    private static Long requireLong(JsonNode node, String field, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            errors.add(field + " is required");
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            errors.add(field + " must be an integer");
            return null;
        }
        return value.asLong();
    }

    private static LicenseTier requireTier(JsonNode node, List<String> errors) {
        String text = requireText(node, "tier", errors);
        if (text == null) {
            return null;
        }
        LicenseTier tier = LicenseTier.fromWireName(text);
        if (tier == null) {
            errors.add("tier must be one of starter, professional, enterprise");
        }
        return tier;
    }

    private static Set<String> requireFeatures(JsonNode node, List<String> errors) {
        JsonNode value = node.get("features");
        if (value == null || value.isNull()) {
            errors.add("features is required");
            return null;
        }
        if (!value.isArray()) {
            errors.add("features must be an array");
            return null;
        }
        if (value.isEmpty()) {
            errors.add("features must not be empty");
            return null;
        }
        Set<String> features = new LinkedHashSet<>();
        for (int i = 0; i < value.size(); i++) {
            JsonNode feature = value.get(i);
            if (!feature.isTextual() || feature.asText().isBlank()) {
                errors.add("features[" + i + "] must be a non-blank string");
                continue;
            }
            features.add(feature.asText());
        }
        return features;
    }

    private static Map<LicenseLimit, Long> requireLimits(JsonNode node, List<String> errors) {
        JsonNode value = node.get("limits");
        if (value == null || value.isNull()) {
            errors.add("limits is required");
            return null;
        }
        if (!value.isObject()) {
            errors.add("limits must be an object");
            return null;
        }
        Map<LicenseLimit, Long> limits = new EnumMap<>(LicenseLimit.class);
        // Keys other than the known quotas are ignored.
        for (LicenseLimit limit : LicenseLimit.values()) {
            String field = "limits." + limit.key();
            JsonNode entry = value.get(limit.key());
            if (entry == null || entry.isNull()) {
                errors.add(field + " is required");
                continue;
            }
            if (!entry.isIntegralNumber() || !entry.canConvertToLong()) {
                errors.add(field + " must be an integer");
                continue;
            }
            long amount = entry.asLong();
            if (amount <= 0) {
                errors.add(field + " must be greater than 0");
                continue;
            }
            limits.put(limit, amount);
        }
        return limits;
    }
}
