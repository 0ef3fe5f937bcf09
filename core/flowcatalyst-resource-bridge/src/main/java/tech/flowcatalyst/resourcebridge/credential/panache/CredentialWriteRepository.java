package tech.flowcatalyst.resourcebridge.credential.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.flowcatalyst.resourcebridge.credential.Credential;
import tech.flowcatalyst.resourcebridge.credential.entity.CredentialEntity;
import tech.flowcatalyst.resourcebridge.credential.mapper.CredentialMapper;

import java.time.Instant;

/**
 * Write-side repository for Credential entities.
 * Extends PanacheRepositoryBase for efficient entity persistence.
 */
@ApplicationScoped
@Transactional
public class CredentialWriteRepository implements PanacheRepositoryBase<CredentialEntity, String> {

    public void persistCredential(Credential credential) {
        Instant now = Instant.now();
        if (credential.createdAt == null) {
            credential.createdAt = now;
        }
        credential.updatedAt = now;

        persist(CredentialMapper.toEntity(credential));
    }

    public void updateCredential(Credential credential) {
        credential.updatedAt = Instant.now();

        CredentialEntity entity = findById(credential.id);
        if (entity != null) {
            CredentialMapper.updateEntity(entity, credential);
        }
    }

    /**
     * Touch last_used_at without loading the credential's collections.
     */
    public int updateLastUsed(String id, Instant lastUsedAt) {
        return update("lastUsedAt = ?1 where id = ?2", lastUsedAt, id);
    }
}
