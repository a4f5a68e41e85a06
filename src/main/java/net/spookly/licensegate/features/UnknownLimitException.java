package net.spookly.licensegate.features;

import java.util.List;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised when a limit is requested by a key the license does not define.
 */
@Getter
@Accessors(fluent = true)
public class UnknownLimitException extends RuntimeException {
    private final String key;
    private final List<String> availableKeys;

    public UnknownLimitException(String key, List<String> availableKeys) {
        super("Unknown limit key: " + key + ". Available limits: " + String.join(", ", availableKeys));
        this.key = key;
        this.availableKeys = List.copyOf(availableKeys);
    }
}
