package tech.flowcatalyst.resourcebridge.credential;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Generation and salted hashing of credential secrets.
 *
 * <p>Hash = hex(SHA-256(salt + secret)); comparison is constant-time.
 */
public final class SecretHasher {

    static final int KEY_LENGTH = 16;
    static final int SECRET_BYTES = 48;
    static final int SALT_BYTES = 16;

    private static final String KEY_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private SecretHasher() {
    }

    /**
     * Public lookup key: lowercase alphanumeric, no separator characters.
     */
    public static String newKey() {
        StringBuilder key = new StringBuilder(KEY_LENGTH);
        for (int i = 0; i < KEY_LENGTH; i++) {
            key.append(KEY_ALPHABET.charAt(SECURE_RANDOM.nextInt(KEY_ALPHABET.length())));
        }
        return key.toString();
    }

    public static String newSecret() {
        return randomUrlSafe(SECRET_BYTES);
    }

    public static String newSalt() {
        return randomUrlSafe(SALT_BYTES);
    }

    public static String hash(String salt, String secret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest((salt + secret).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Constant-time check of a presented secret against a stored hash.
     */
    public static boolean matches(String salt, String presentedSecret, String storedHash) {
        if (salt == null || storedHash == null || presentedSecret == null) {
            return false;
        }
        byte[] expected = storedHash.getBytes(StandardCharsets.US_ASCII);
        byte[] actual = hash(salt, presentedSecret).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    private static String randomUrlSafe(int byteCount) {
        byte[] bytes = new byte[byteCount];
        SECURE_RANDOM.nextBytes(bytes);
        return URL_ENCODER.encodeToString(bytes);
    }
}
