package tech.flowcatalyst.resourcebridge.credential;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Secret lifecycle of credentials: issuing, verifying and usage tracking.
 *
 * <p>Every verification failure looks the same to the caller. Unknown key,
 * wrong secret, inactive and expired all return empty; only the debug log
 * tells them apart.
 */
@ApplicationScoped
public class CredentialService {

    private static final Logger LOG = Logger.getLogger(CredentialService.class);

    private static final int MAX_KEY_ATTEMPTS = 5;

    @Inject
    CredentialRepository repository;

    @Inject
    ResourceBridgeConfig config;

    /**
     * Assign a fresh key (if the credential has none), salt and secret hash.
     *
     * <p>Keeps an existing key, so regenerating a credential preserves its
     * identifier while the old secret stops matching.
     *
     * @return the plaintext token; it is not stored anywhere
     */
    public String assignSecret(Credential credential) {
        if (credential.tokenKey == null) {
            credential.tokenKey = uniqueKey();
        }
        String secret = SecretHasher.newSecret();
        credential.salt = SecretHasher.newSalt();
        credential.secretHash = SecretHasher.hash(credential.salt, secret);

        return new CredentialToken(tokenPrefix(), credential.tokenKey, secret).format();
    }

    /**
     * Expiry for a credential created without an explicit one.
     */
    public Instant defaultExpiry(Instant now) {
        return now.plus(Duration.ofDays(config.credentials().defaultLifetimeDays()));
    }

    /**
     * Verify a presented token.
     *
     * @return the credential if the token matches a valid credential
     */
    public Optional<Credential> verify(String presented) {
        Optional<CredentialToken> parsed = CredentialToken.parse(tokenPrefix(), presented);
        if (parsed.isEmpty()) {
            LOG.debug("Rejected credential: malformed token");
            return Optional.empty();
        }
        CredentialToken token = parsed.get();

        Optional<Credential> found = repository.findByTokenKey(token.key());
        if (found.isEmpty()) {
            // Keep the work comparable to a real check
            SecretHasher.hash(token.key(), token.secret());
            LOG.debugf("Rejected credential [%s]: unknown key", token.key());
            return Optional.empty();
        }

        Credential credential = found.get();
        if (!SecretHasher.matches(credential.salt, token.secret(), credential.secretHash)) {
            LOG.debugf("Rejected credential [%s]: secret mismatch", token.key());
            return Optional.empty();
        }
        if (!credential.isValid(Instant.now())) {
            LOG.debugf("Rejected credential [%s]: %s", token.key(), credential.status(Instant.now()));
            return Optional.empty();
        }
        return Optional.of(credential);
    }

    /**
     * Record a successful use. Failure here never fails authentication.
     */
    public void markUsed(Credential credential) {
        Instant now = Instant.now();
        try {
            repository.updateLastUsed(credential.id, now);
            credential.lastUsedAt = now;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to record last use of credential [%s]", credential.id);
        }
    }

    public String tokenPrefix() {
        return config.credentials().tokenPrefix();
    }

    private String uniqueKey() {
        for (int attempt = 0; attempt < MAX_KEY_ATTEMPTS; attempt++) {
            String key = SecretHasher.newKey();
            if (!repository.existsByTokenKey(key)) {
                return key;
            }
            LOG.debugf("Token key collision, retrying (attempt %d)", attempt + 1);
        }
        throw new IllegalStateException("Could not allocate a unique token key");
    }
}
