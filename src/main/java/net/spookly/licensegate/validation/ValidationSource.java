package net.spookly.licensegate.validation;

/**
 * Where the returned result came from.
 */
public enum ValidationSource {
    MEMORY_CACHE,
    OFFLINE_CACHE,
    REMOTE,
    LOCAL
}
