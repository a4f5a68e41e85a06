package net.spookly.licensegate.validation;

/**
 * Audit event types emitted by the validator.
 */
public enum ValidationEventType {
    /** A validate call finished. */
    VALIDATED,
    /** The licensing authority could not be reached; the offline cache was consulted. */
    PHONE_HOME_UNAVAILABLE,
    /** The offline cache only held an entry past the offline window. */
    OFFLINE_CACHE_EXPIRED
}
