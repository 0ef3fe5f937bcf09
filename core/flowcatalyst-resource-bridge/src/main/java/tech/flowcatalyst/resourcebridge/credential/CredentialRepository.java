package tech.flowcatalyst.resourcebridge.credential;

import tech.flowcatalyst.resourcebridge.common.OffsetPage;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for Credential entities.
 */
public interface CredentialRepository {

    // Read operations
    Optional<Credential> findById(String id);
    Optional<Credential> findByTokenKey(String tokenKey);
    boolean existsByTokenKey(String tokenKey);

    /**
     * Credentials ordered newest first.
     */
    OffsetPage<Credential> findPage(int offset, int limit);

    // Write operations
    void persist(Credential credential);
    void update(Credential credential);
    void updateLastUsed(String id, Instant lastUsedAt);
}
