package net.spookly.licensegate.remote;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Verdict of the licensing authority.
 */
@Value
@Accessors(fluent = true)
public class PhoneHomeResponse {
    boolean valid;
    /** Why the authority rejected the license, if it said. */
    String reason;
    /** Epoch value the authority suggests caching until, or {@code null}. */
    Long cachedUntil;
}
