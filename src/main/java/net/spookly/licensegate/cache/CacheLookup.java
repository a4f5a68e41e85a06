package net.spookly.licensegate.cache;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.licensegate.validation.ValidationResult;

/**
 * Result of reading one offline cache entry, including why nothing usable was found.
 */
@Value
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CacheLookup {
    Status status;
    ValidationResult result;

    public static CacheLookup hit(ValidationResult result) {
        return new CacheLookup(Status.HIT, result);
    }

    public static CacheLookup miss() {
        return new CacheLookup(Status.MISS, null);
    }

    public static CacheLookup expired() {
        return new CacheLookup(Status.EXPIRED, null);
    }

    public static CacheLookup corrupt() {
        return new CacheLookup(Status.CORRUPT, null);
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public Optional<ValidationResult> asOptional() {
        return Optional.ofNullable(result);
    }

    public enum Status {
        HIT,
        MISS,
        /** Entry was older than the offline window and has been removed. */
        EXPIRED,
        /** Entry could not be parsed and has been removed. */
        CORRUPT
    }
}
