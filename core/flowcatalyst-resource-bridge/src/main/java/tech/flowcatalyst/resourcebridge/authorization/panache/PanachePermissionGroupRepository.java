package tech.flowcatalyst.resourcebridge.authorization.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.flowcatalyst.resourcebridge.authorization.PermissionGroup;
import tech.flowcatalyst.resourcebridge.authorization.PermissionGroupRepository;
import tech.flowcatalyst.resourcebridge.authorization.entity.PermissionGroupEntity;
import tech.flowcatalyst.resourcebridge.authorization.mapper.PermissionGroupMapper;
import tech.flowcatalyst.resourcebridge.shared.EntityType;
import tech.flowcatalyst.resourcebridge.shared.TsidGenerator;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * EntityManager-based implementation of PermissionGroupRepository.
 */
@ApplicationScoped
public class PanachePermissionGroupRepository implements PermissionGroupRepository {

    @Inject
    EntityManager em;

    @Override
    public Optional<PermissionGroup> findByName(String name) {
        return em.createQuery("FROM PermissionGroupEntity WHERE name = :name", PermissionGroupEntity.class)
            .setParameter("name", name)
            .getResultList()
            .stream()
            .findFirst()
            .map(PermissionGroupMapper::toDomain);
    }

    @Override
    public List<PermissionGroup> findByNames(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        return em.createQuery("FROM PermissionGroupEntity WHERE name IN :names", PermissionGroupEntity.class)
            .setParameter("names", names)
            .getResultList()
            .stream()
            .map(PermissionGroupMapper::toDomain)
            .toList();
    }

    @Override
    public List<PermissionGroup> listAll() {
        return em.createQuery("FROM PermissionGroupEntity ORDER BY name", PermissionGroupEntity.class)
            .getResultList()
            .stream()
            .map(PermissionGroupMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(PermissionGroup group) {
        if (group.id == null) {
            group.id = TsidGenerator.generate(EntityType.PERMISSION_GROUP);
        }
        if (group.createdAt == null) {
            group.createdAt = Instant.now();
        }
        em.persist(PermissionGroupMapper.toEntity(group));
    }
}
