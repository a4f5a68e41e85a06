package net.spookly.licensegate.token;

/**
 * Redacts license tokens for logs and diagnostic output.
 */
public final class TokenRedactor {
    private static final String REDACTED = "REDACTED";
    private static final int VISIBLE_PREFIX = 8;

    private TokenRedactor() {
    }

    /**
     * Return a safe representation of a license token for logging.
     *
     * @param token the raw token value
     * @return {@code null} when the token is {@code null}, otherwise {@code REDACTED}
     */
    public static String redact(String token) {
        if (token == null) {
            return null;
        }
        if (token.isEmpty()) {
            return "";
        }
        return REDACTED;
    }

    /**
     * Shorten a one-way cache key so log lines can be correlated without exposing the full hash.
     */
    public static String shortKey(String cacheKey) {
        if (cacheKey == null || cacheKey.length() <= VISIBLE_PREFIX) {
            return cacheKey;
        }
        return cacheKey.substring(0, VISIBLE_PREFIX);
    }
}
