package net.spookly.licensegate.remote;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Typed failure of a phone-home exchange. A failure never means the license is valid.
 */
@Getter
@Accessors(fluent = true)
public class PhoneHomeException extends Exception {
    private final Kind kind;

    public PhoneHomeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PhoneHomeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public enum Kind {
        /** No response within the configured timeout; the exchange was cancelled. */
        TIMEOUT,
        NETWORK_ERROR,
        /** Non-2xx status or an unusable response body. */
        SERVER_ERROR
    }
}
