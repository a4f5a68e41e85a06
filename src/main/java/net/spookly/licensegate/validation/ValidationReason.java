package net.spookly.licensegate.validation;

/**
 * Why a license was rejected, or why a fallback path was taken.
 */
public enum ValidationReason {
    INVALID_FORMAT,
    INVALID_SIGNATURE,
    INVALID_SCHEMA,
    NOT_YET_VALID,
    EXPIRED,
    MACHINE_MISMATCH,
    /** The licensing authority rejected the token, or could not be reached when reported in events. */
    PHONE_HOME_FAILED,
    /**
     * The offline cache only held an expired entry. Reported in events and metrics; validation
     * then continues with the locally derived result.
     */
    OFFLINE_CACHE_EXPIRED
}
