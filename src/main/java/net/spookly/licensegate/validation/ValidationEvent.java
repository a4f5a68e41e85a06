package net.spookly.licensegate.validation;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Snapshot of one validation step for audit logging. Carries the shortened token hash, never the token.
 */
@Value
@Accessors(fluent = true)
public class ValidationEvent {
    ValidationEventType type;
    Instant timestamp;
    String cacheKey;
    ValidationSource source;
    Boolean valid;
    ValidationReason reason;
    String detail;
    String tier;
    Long latencyMs;

    public static ValidationEvent completed(String cacheKey,
                                            ValidationSource source,
                                            ValidationResult result,
                                            long latencyMs,
                                            Instant timestamp) {
        return new ValidationEvent(
                ValidationEventType.VALIDATED,
                timestamp,
                cacheKey,
                source,
                result.valid(),
                result.reason(),
                result.detail(),
                result.claims() == null ? null : result.claims().tier().wireName(),
                latencyMs
        );
    }

    public static ValidationEvent fallback(ValidationEventType type,
                                           String cacheKey,
                                           ValidationReason reason,
                                           String detail,
                                           Instant timestamp) {
        return new ValidationEvent(type, timestamp, cacheKey, null, null, reason, detail, null, null);
    }
}
