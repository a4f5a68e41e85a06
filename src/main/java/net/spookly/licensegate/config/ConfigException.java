package net.spookly.licensegate.config;

/**
 * Raised when the configuration is missing, unreadable, or invalid.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
