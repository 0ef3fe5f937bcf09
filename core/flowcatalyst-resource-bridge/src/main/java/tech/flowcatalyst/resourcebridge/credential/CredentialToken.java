package tech.flowcatalyst.resourcebridge.credential;

import java.util.Optional;

/**
 * The three parts of a plaintext token: {@code <prefix>_<key>_<secret>}.
 *
 * <p>The key contains no underscore, so the token splits at the first two
 * underscores. The secret itself may contain underscores (base64url).
 */
public record CredentialToken(String prefix, String key, String secret) {

    public static final char SEPARATOR = '_';

    /**
     * Parse a presented token. Any malformed input gives empty.
     */
    public static Optional<CredentialToken> parse(String expectedPrefix, String presented) {
        if (presented == null || presented.isEmpty()) {
            return Optional.empty();
        }
        int first = presented.indexOf(SEPARATOR);
        if (first <= 0) {
            return Optional.empty();
        }
        int second = presented.indexOf(SEPARATOR, first + 1);
        if (second < 0) {
            return Optional.empty();
        }

        String prefix = presented.substring(0, first);
        String key = presented.substring(first + 1, second);
        String secret = presented.substring(second + 1);
        if (!prefix.equals(expectedPrefix) || key.isEmpty() || secret.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CredentialToken(prefix, key, secret));
    }

    public String format() {
        return prefix + SEPARATOR + key + SEPARATOR + secret;
    }

    @Override
    public String toString() {
        // Never render the secret
        return prefix + SEPARATOR + key + SEPARATOR + "***";
    }
}
