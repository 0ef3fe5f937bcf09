package tech.flowcatalyst.resourcebridge.credential.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.flowcatalyst.resourcebridge.common.OffsetPage;
import tech.flowcatalyst.resourcebridge.credential.Credential;
import tech.flowcatalyst.resourcebridge.credential.CredentialRepository;
import tech.flowcatalyst.resourcebridge.credential.entity.CredentialEntity;
import tech.flowcatalyst.resourcebridge.credential.mapper.CredentialMapper;
import tech.flowcatalyst.resourcebridge.shared.EntityType;
import tech.flowcatalyst.resourcebridge.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for Credential entities.
 * Uses EntityManager directly to return domain objects; writes delegate to
 * {@link CredentialWriteRepository}.
 */
@ApplicationScoped
public class CredentialReadRepository implements CredentialRepository {

    @Inject
    EntityManager em;

    @Inject
    CredentialWriteRepository writeRepo;

    @Override
    public Optional<Credential> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(CredentialMapper.toDomain(em.find(CredentialEntity.class, id)));
    }

    @Override
    public Optional<Credential> findByTokenKey(String tokenKey) {
        return em.createQuery("FROM CredentialEntity WHERE tokenKey = :tokenKey", CredentialEntity.class)
            .setParameter("tokenKey", tokenKey)
            .getResultList()
            .stream()
            .findFirst()
            .map(CredentialMapper::toDomain);
    }

    @Override
    public boolean existsByTokenKey(String tokenKey) {
        return em.createQuery("SELECT COUNT(e) FROM CredentialEntity e WHERE e.tokenKey = :tokenKey", Long.class)
            .setParameter("tokenKey", tokenKey)
            .getSingleResult() > 0;
    }

    @Override
    public OffsetPage<Credential> findPage(int offset, int limit) {
        List<Credential> items = em.createQuery(
                "FROM CredentialEntity ORDER BY createdAt DESC, id DESC", CredentialEntity.class)
            .setFirstResult(offset)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(CredentialMapper::toDomain)
            .toList();

        long total = em.createQuery("SELECT COUNT(e) FROM CredentialEntity e", Long.class)
            .getSingleResult();

        return new OffsetPage<>(items, total, offset, limit);
    }

    @Override
    public void persist(Credential credential) {
        if (credential.id == null) {
            credential.id = TsidGenerator.generate(EntityType.CREDENTIAL);
        }
        writeRepo.persistCredential(credential);
    }

    @Override
    public void update(Credential credential) {
        writeRepo.updateCredential(credential);
    }

    @Override
    public void updateLastUsed(String id, Instant lastUsedAt) {
        writeRepo.updateLastUsed(id, lastUsedAt);
    }
}
