package net.spookly.licensegate.token;

/**
 * Raised when a license token cannot be split or decoded.
 */
public class TokenFormatException extends Exception {
    public TokenFormatException(String message) {
        super(message);
    }

    public TokenFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
