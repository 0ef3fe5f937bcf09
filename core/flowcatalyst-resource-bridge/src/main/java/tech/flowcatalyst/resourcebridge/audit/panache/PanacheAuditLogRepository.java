package tech.flowcatalyst.resourcebridge.audit.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.flowcatalyst.resourcebridge.audit.AuditLog;
import tech.flowcatalyst.resourcebridge.audit.AuditLogRepository;
import tech.flowcatalyst.resourcebridge.audit.entity.AuditLogEntity;
import tech.flowcatalyst.resourcebridge.audit.mapper.AuditLogMapper;
import tech.flowcatalyst.resourcebridge.shared.EntityType;
import tech.flowcatalyst.resourcebridge.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;

/**
 * EntityManager-based implementation of AuditLogRepository.
 */
@ApplicationScoped
public class PanacheAuditLogRepository implements AuditLogRepository {

    @Inject
    EntityManager em;

    @Override
    public void persist(AuditLog log) {
        if (log.id == null) {
            log.id = TsidGenerator.generate(EntityType.AUDIT_LOG);
        }
        if (log.performedAt == null) {
            log.performedAt = Instant.now();
        }
        em.persist(AuditLogMapper.toEntity(log));
    }

    @Override
    public List<AuditLog> findByObject(String resource, String objectId, int limit) {
        return em.createQuery(
                "FROM AuditLogEntity WHERE resource = :resource AND objectId = :objectId " +
                    "ORDER BY performedAt DESC, id DESC",
                AuditLogEntity.class)
            .setParameter("resource", resource)
            .setParameter("objectId", objectId)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(AuditLogMapper::toDomain)
            .toList();
    }

    @Override
    public long countByObject(String resource, String objectId) {
        return em.createQuery(
                "SELECT COUNT(e) FROM AuditLogEntity e WHERE e.resource = :resource AND e.objectId = :objectId",
                Long.class)
            .setParameter("resource", resource)
            .setParameter("objectId", objectId)
            .getSingleResult();
    }
}
