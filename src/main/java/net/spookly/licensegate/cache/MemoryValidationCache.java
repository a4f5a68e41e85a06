package net.spookly.licensegate.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.licensegate.config.ConfigException;
import net.spookly.licensegate.validation.ValidationResult;

/**
 * Short-lived in-process cache of validation results keyed by token hash.
 */
public final class MemoryValidationCache {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    /**
     * @param validationMinutes how long a result stays fresh.
     */
    public MemoryValidationCache(int validationMinutes, Clock clock) {
        if (validationMinutes <= 0) {
            throw new ConfigException("Validation cache minutes must be greater than 0");
        }
        this.ttl = Duration.ofMinutes(validationMinutes);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Return a fresh entry; an expired entry is removed and reported as absent.
     */
    public Optional<ValidationResult> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.result);
    }

    public void put(String key, ValidationResult result) {
        Instant now = clock.instant();
        purge(now);
        entries.put(key, new Entry(result, now));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private void purge(Instant now) {
        for (Map.Entry<String, Entry> entry : entries.entrySet()) {
            if (isExpired(entry.getValue(), now)) {
                entries.remove(entry.getKey(), entry.getValue());
            }
        }
    }

    private boolean isExpired(Entry entry, Instant now) {
        return entry.cachedAt.plus(ttl).isBefore(now);
    }

    private static final class Entry {
        private final ValidationResult result;
        private final Instant cachedAt;

        private Entry(ValidationResult result, Instant cachedAt) {
            this.result = result;
            this.cachedAt = cachedAt;
        }
    }
}
