package net.spookly.licensegate.claims;

public enum TemporalStatus {
    VALID,
    /** Issued in the future relative to the local clock. */
    NOT_YET_VALID,
    EXPIRED
}
