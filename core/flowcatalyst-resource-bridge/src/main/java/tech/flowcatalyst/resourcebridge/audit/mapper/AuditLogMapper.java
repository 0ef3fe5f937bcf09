package tech.flowcatalyst.resourcebridge.audit.mapper;

import tech.flowcatalyst.resourcebridge.audit.AuditLog;
import tech.flowcatalyst.resourcebridge.audit.entity.AuditLogEntity;

/**
 * Mapper between AuditLog domain model and AuditLogEntity.
 */
public final class AuditLogMapper {

    private AuditLogMapper() {
    }

    public static AuditLog toDomain(AuditLogEntity entity) {
        if (entity == null) {
            return null;
        }

        AuditLog log = new AuditLog();
        log.id = entity.id;
        log.resource = entity.resource;
        log.objectId = entity.objectId;
        log.objectRepr = entity.objectRepr;
        log.kind = entity.kind;
        log.changeMessage = entity.changeMessage;
        log.principalId = entity.principalId;
        log.performedAt = entity.performedAt;
        return log;
    }

    public static AuditLogEntity toEntity(AuditLog domain) {
        if (domain == null) {
            return null;
        }

        AuditLogEntity entity = new AuditLogEntity();
        entity.id = domain.id;
        entity.resource = domain.resource;
        entity.objectId = domain.objectId;
        entity.objectRepr = domain.objectRepr;
        entity.kind = domain.kind;
        entity.changeMessage = domain.changeMessage;
        entity.principalId = domain.principalId;
        entity.performedAt = domain.performedAt;
        return entity;
    }
}
