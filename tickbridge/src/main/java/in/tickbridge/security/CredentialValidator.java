package in.tickbridge.security;

import in.tickbridge.infrastructure.broker.data.FeedAuthenticationException;

import java.util.regex.Pattern;

/**
 * Format checks for FlatTrade session tokens.
 *
 * Session tokens are hexadecimal strings of at least 32 characters. The check
 * is local only; whether the broker still honours the token is learned at
 * handshake time.
 *
 * Usage:
 * <pre>
 * String credential = CredentialValidator.requireValid(CredentialValidator.stripBearer(header));
 * log.info("user token {}", CredentialValidator.mask(credential));
 * </pre>
 */
public final class CredentialValidator {

    private static final Pattern HEX_PATTERN = Pattern.compile("^[a-fA-F0-9]+$");
    private static final int MIN_LENGTH = 32;

    private CredentialValidator() {}

    public static boolean isValidSessionToken(String token) {
        if (token == null || token.length() < MIN_LENGTH) {
            return false;
        }
        return HEX_PATTERN.matcher(token).matches();
    }

    /**
     * @throws FeedAuthenticationException if the token is missing or malformed
     */
    public static String requireValid(String token) {
        if (token == null || token.isBlank()) {
            throw new FeedAuthenticationException("Missing session token");
        }
        if (!isValidSessionToken(token)) {
            throw new FeedAuthenticationException("Invalid session token format: " + mask(token));
        }
        return token;
    }

    /**
     * Remove a leading {@code Bearer } scheme, if present.
     */
    public static String stripBearer(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        if (v.regionMatches(true, 0, "bearer ", 0, 7)) {
            return v.substring(7).trim();
        }
        return v;
    }

    /**
     * Mask a token for logging: {@code abcdef...wxyz}.
     */
    public static String mask(String token) {
        if (token == null || token.isEmpty()) {
            return "None";
        }
        if (token.length() <= 12) {
            return token.substring(0, Math.min(4, token.length())) + "...";
        }
        return token.substring(0, 6) + "..." + token.substring(token.length() - 4);
    }
}
